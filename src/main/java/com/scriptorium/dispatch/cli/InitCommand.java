package com.scriptorium.dispatch.cli;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.UUID;

/**
 * CLI command: scriptorium init &lt;project-id&gt; &lt;project-name&gt;
 */
@Command(name = "init", mixinStandardHelpOptions = true, description = "Initialize a project repository")
@Component
public class InitCommand implements Runnable {

    @Parameters(index = "0", description = "Project id (UUID)")
    private UUID projectId;

    @Parameters(index = "1", description = "Project name, used for the directory name")
    private String projectName;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;

    public InitCommand(VersionControlEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        var result = engine.initialize(projectId, projectName, actor.toActor());
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        var init = result.value();
        if (init.created()) {
            ConsoleOutput.success("Repository initialized at " + init.repoPath());
        } else {
            ConsoleOutput.info("Repository already initialized at " + init.repoPath());
        }
        System.out.println("Main branch: " + init.mainBranchId());
    }
}
