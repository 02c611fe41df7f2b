package com.scriptorium.dispatch.cli;

import com.scriptorium.core.compile.CompilationJob;
import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.engine.VersionControlEngine;
import com.scriptorium.core.model.Actor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.UUID;

/**
 * CLI command: scriptorium compile &lt;branch-id&gt; &lt;subproject&gt;
 * <p>
 * Submits a compilation. With {@code --wait} it polls the job until it
 * finishes and marks it timed out once the deadline passes.
 */
@Command(name = "compile", mixinStandardHelpOptions = true, description = "Compile a LaTeX sub-project")
@Component
public class CompileCommand implements Runnable {

    private static final long POLL_INTERVAL_MS = 1000;

    @Parameters(index = "0", description = "Branch id (UUID)")
    private UUID branchId;

    @Parameters(index = "1", description = "Sub-project directory")
    private String subprojectId;

    @Option(names = "--main", defaultValue = "main.tex", description = "Main file (default: ${DEFAULT-VALUE})")
    private String mainFile;

    @Option(names = "--engine", defaultValue = "pdflatex",
            description = "pdflatex, xelatex, lualatex or latex (default: ${DEFAULT-VALUE})")
    private String engineName;

    @Option(names = "--format", defaultValue = "pdf", description = "pdf, dvi or ps (default: ${DEFAULT-VALUE})")
    private String format;

    @Option(names = {"--wait", "-w"}, description = "Wait for the compilation to finish")
    private boolean waitForResult;

    @Option(names = "--timeout", description = "Seconds to wait before marking the job timed out")
    private Integer timeoutSeconds;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;
    private final ScriptoriumProperties properties;

    public CompileCommand(VersionControlEngine engine, ScriptoriumProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public void run() {
        Actor caller = actor.toActor();
        var submitted = engine.submitCompilation(branchId, subprojectId, mainFile, engineName, format, caller);
        if (!submitted.isSuccess()) {
            ConsoleOutput.failure(submitted);
            return;
        }
        String jobId = submitted.value().jobId();
        ConsoleOutput.success("Compilation " + jobId + " started");
        if (!waitForResult) {
            return;
        }

        int timeout = timeoutSeconds != null ? timeoutSeconds : properties.getCompilationTimeoutSeconds();
        long deadline = System.currentTimeMillis() + timeout * 1000L;
        CompilationJob job = submitted.value();
        while (!job.status().isTerminal()) {
            if (System.currentTimeMillis() >= deadline) {
                var expired = engine.markCompilationTimeout(jobId);
                if (!expired.isSuccess()) {
                    ConsoleOutput.failure(expired);
                    return;
                }
                job = expired.value();
                break;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ConsoleOutput.error("Interrupted while waiting for " + jobId);
                return;
            }
            var status = engine.getCompilationStatus(jobId, caller);
            if (!status.isSuccess()) {
                ConsoleOutput.failure(status);
                return;
            }
            job = status.value();
        }
        ConsoleOutput.job(job);
    }
}
