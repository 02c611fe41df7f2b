package com.scriptorium.dispatch.cli;

import com.scriptorium.core.engine.VersionControlEngine;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.FileEntry;
import com.scriptorium.core.subproject.Subproject;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * CLI command: scriptorium subproject &lt;branch-id&gt; [--create NAME | --show NAME | --delete NAME]
 * <p>
 * Lists the LaTeX sub-projects of a branch by default.
 */
@Command(name = "subproject", mixinStandardHelpOptions = true,
        description = "List, show, create or delete LaTeX sub-projects")
@Component
public class SubprojectCommand implements Runnable {

    @Parameters(index = "0", description = "Branch id (UUID)")
    private UUID branchId;

    @Option(names = {"--create", "-c"}, description = "Create a sub-project with this name")
    private String create;

    @Option(names = "--show", description = "Show the files of a sub-project")
    private String show;

    @Option(names = "--delete", description = "Delete a sub-project and all its files")
    private String delete;

    @Option(names = "--template", description = "article, report, book or beamer (default: article)")
    private String template;

    @Option(names = "--file", description = "Add or replace a file on create: PATH=LOCAL_FILE")
    private Map<String, Path> localFiles = new LinkedHashMap<>();

    @Option(names = {"--message", "-m"}, description = "Commit message")
    private String message;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;

    public SubprojectCommand(VersionControlEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        if (Stream.of(create, show, delete).filter(Objects::nonNull).count() > 1) {
            ConsoleOutput.error("Use only one of --create, --show and --delete");
            return;
        }
        Actor caller = actor.toActor();
        if (create != null) {
            create(create, caller);
        } else if (show != null) {
            var result = engine.getSubproject(branchId, show, caller);
            if (!result.isSuccess()) {
                ConsoleOutput.failure(result);
                return;
            }
            printFiles(result.value());
        } else if (delete != null) {
            var result = engine.deleteSubproject(branchId, delete, message, caller);
            if (!result.isSuccess()) {
                ConsoleOutput.failure(result);
                return;
            }
            ConsoleOutput.success("Deleted " + delete + " in " + result.value().commitHash());
        } else {
            list(caller);
        }
    }

    private void create(String name, Actor caller) {
        Map<String, String> contents = new LinkedHashMap<>();
        for (Map.Entry<String, Path> file : localFiles.entrySet()) {
            try {
                contents.put(file.getKey(), Files.readString(file.getValue(), StandardCharsets.UTF_8));
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read " + file.getValue() + ": " + e.getMessage());
                return;
            }
        }
        var result = engine.createSubproject(branchId, name, template, contents, message, caller);
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        ConsoleOutput.success("Created LaTeX project " + name);
        printFiles(result.value());
    }

    private void list(Actor caller) {
        var result = engine.listSubprojects(branchId, caller);
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        for (Subproject subproject : result.value()) {
            System.out.printf("%-30s %-40s files=%d%n", subproject.name(),
                    subproject.directory() + "/" + subproject.mainFile(), subproject.fileCount());
        }
        System.out.println("──────────────────────────────────");
        System.out.println(result.value().size() + " sub-project(s)");
    }

    private static void printFiles(Subproject subproject) {
        System.out.println("Main file: " + subproject.mainFile());
        for (FileEntry entry : subproject.files()) {
            System.out.printf("  %-50s %8d%n", entry.path(), entry.size());
        }
    }
}
