package com.scriptorium.dispatch.cli;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * CLI command: scriptorium write &lt;branch-id&gt; &lt;path&gt; (--content TEXT | --from-file FILE)
 */
@Command(name = "write", mixinStandardHelpOptions = true, description = "Write and commit a file on a branch")
@Component
public class WriteCommand implements Runnable {

    @Parameters(index = "0", description = "Branch id (UUID)")
    private UUID branchId;

    @Parameters(index = "1", description = "Repository-relative file path")
    private String path;

    @Option(names = "--content", description = "File content")
    private String content;

    @Option(names = "--from-file", description = "Local file whose content is written")
    private Path fromFile;

    @Option(names = {"--message", "-m"}, description = "Commit message")
    private String message;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;

    public WriteCommand(VersionControlEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        String text = content;
        if (fromFile != null) {
            try {
                text = Files.readString(fromFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read " + fromFile + ": " + e.getMessage());
                return;
            }
        }
        var result = engine.writeFile(branchId, path, text, message, actor.toActor());
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        var commit = result.value();
        if (commit.changed()) {
            ConsoleOutput.success("Committed " + commit.path() + " as " + commit.commitHash());
        } else {
            ConsoleOutput.info(commit.path() + " unchanged at " + commit.commitHash());
        }
    }
}
