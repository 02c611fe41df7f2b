package com.scriptorium.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.List;

/**
 * Runs the picocli command tree once the Spring context is up and reports its
 * exit code back to {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    /** Global flag, consumed before Spring starts, that selects the {@code memory} profile. */
    public static final String MEMORY_FLAG = "--memory";

    /** Exit code when a command fails outside the engine's result model, e.g. the index is unreachable. */
    static final int INFRASTRUCTURE_FAILURE = 2;

    private final ScriptoriumCommand scriptoriumCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ScriptoriumCommand scriptoriumCommand, IFactory factory) {
        this.scriptoriumCommand = scriptoriumCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand is {@code serve} and no help was asked for. Only the
     * first positional argument names the subcommand, so a file called "serve" given
     * to {@code write} does not start the server.
     */
    public static boolean isServeInvocation(List<String> args) {
        boolean serve = false;
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                return false;
            }
            if (!serve && !arg.startsWith("-")) {
                if (!arg.equals("serve")) {
                    return false;
                }
                serve = true;
            }
        }
        return serve;
    }

    @Override
    public void run(String... args) {
        // the embedded web server owns the process in serve mode
        if (isServeInvocation(List.of(args))) {
            return;
        }
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(scriptoriumCommand, factory)
                .setExecutionExceptionHandler((e, cmd, parsed) -> {
                    log.debug("Command '{}' failed", cmd.getCommandName(), e);
                    ConsoleOutput.error(cmd.getCommandName() + " failed: " + e.getMessage());
                    return INFRASTRUCTURE_FAILURE;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
