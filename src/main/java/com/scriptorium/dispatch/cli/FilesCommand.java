package com.scriptorium.dispatch.cli;

import com.scriptorium.core.engine.VersionControlEngine;
import com.scriptorium.core.model.FileEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.UUID;

/**
 * CLI command: scriptorium files &lt;branch-id&gt;
 */
@Command(name = "files", mixinStandardHelpOptions = true, description = "List files on a branch")
@Component
public class FilesCommand implements Runnable {

    @Parameters(index = "0", description = "Branch id (UUID)")
    private UUID branchId;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;

    public FilesCommand(VersionControlEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        var result = engine.listFiles(branchId, actor.toActor());
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        for (FileEntry entry : result.value()) {
            String marker = entry.tracked() ? (entry.indexed() ? " " : "?") : "!";
            System.out.printf("%s %-50s %8d  %s%n", marker, entry.path(), entry.size(), entry.type().dbValue());
        }
        System.out.println("──────────────────────────────────");
        System.out.println(result.value().size() + " file(s)  (? not indexed, ! not tracked by Git)");
    }
}
