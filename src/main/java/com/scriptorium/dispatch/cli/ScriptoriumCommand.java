package com.scriptorium.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Scriptorium.
 */
@Command(
        name = "scriptorium",
        mixinStandardHelpOptions = true,
        version = "Scriptorium 0.1.0",
        description = "Git-backed version control for collaborative LaTeX projects",
        footer = "%nStart with --memory before the command to run without PostgreSQL.",
        subcommands = {
                InitCommand.class,
                BranchCommand.class,
                WriteCommand.class,
                ReadCommand.class,
                FilesCommand.class,
                SubprojectCommand.class,
                CompileCommand.class,
                JobCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ScriptoriumCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
