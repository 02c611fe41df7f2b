package com.scriptorium.dispatch.cli;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.UUID;

/**
 * CLI command: scriptorium read &lt;branch-id&gt; &lt;path&gt;
 */
@Command(name = "read", mixinStandardHelpOptions = true, description = "Print a file from a branch")
@Component
public class ReadCommand implements Runnable {

    @Parameters(index = "0", description = "Branch id (UUID)")
    private UUID branchId;

    @Parameters(index = "1", description = "Repository-relative file path")
    private String path;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;

    public ReadCommand(VersionControlEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        var result = engine.readFile(branchId, path, actor.toActor());
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        System.out.print(result.value().content());
    }
}
