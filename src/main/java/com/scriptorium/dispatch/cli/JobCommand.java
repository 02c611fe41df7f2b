package com.scriptorium.dispatch.cli;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: scriptorium job &lt;job-id&gt; [--mark-timeout | --mark-failed REASON]
 */
@Command(name = "job", mixinStandardHelpOptions = true, description = "Show or update a compilation job")
@Component
public class JobCommand implements Runnable {

    @Parameters(index = "0", description = "Compilation job id")
    private String jobId;

    @Option(names = "--mark-timeout", description = "Mark the job timed out and stop its process")
    private boolean markTimeout;

    @Option(names = "--mark-failed", paramLabel = "REASON", description = "Mark the job failed")
    private String markFailed;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;

    public JobCommand(VersionControlEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        var result = markTimeout ? engine.markCompilationTimeout(jobId)
                : markFailed != null ? engine.markCompilationFailed(jobId, markFailed)
                : engine.getCompilationStatus(jobId, actor.toActor());
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        ConsoleOutput.job(result.value());
    }
}
