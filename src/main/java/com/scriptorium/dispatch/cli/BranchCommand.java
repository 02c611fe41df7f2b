package com.scriptorium.dispatch.cli;

import com.scriptorium.core.engine.VersionControlEngine;
import com.scriptorium.core.model.BranchSummary;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.UUID;

/**
 * CLI command: scriptorium branch &lt;project-id&gt; [--create NAME [--from SOURCE]]
 * <p>
 * Lists branches, or creates one when {@code --create} is given.
 */
@Command(name = "branch", mixinStandardHelpOptions = true, description = "List or create branches")
@Component
public class BranchCommand implements Runnable {

    @Parameters(index = "0", description = "Project id (UUID)")
    private UUID projectId;

    @Option(names = {"--create", "-c"}, description = "Name of a branch to create")
    private String create;

    @Option(names = "--from", description = "Source branch (default: main)")
    private String from;

    @Option(names = "--description", description = "Description of the new branch")
    private String description;

    @Option(names = "--page", defaultValue = "1", description = "Page number (default: ${DEFAULT-VALUE})")
    private int page;

    @Option(names = "--size", defaultValue = "20", description = "Page size (default: ${DEFAULT-VALUE})")
    private int size;

    @Mixin
    private ActorOptions actor;

    private final VersionControlEngine engine;

    public BranchCommand(VersionControlEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        if (create != null) {
            var result = engine.createBranch(projectId, create, from, description, actor.toActor());
            if (!result.isSuccess()) {
                ConsoleOutput.failure(result);
                return;
            }
            ConsoleOutput.success("Created branch " + result.value().name() + " (" + result.value().id() + ")");
            System.out.println("Head: " + result.value().headCommitHash());
            return;
        }

        var result = engine.listBranches(projectId, page, size, actor.toActor());
        if (!result.isSuccess()) {
            ConsoleOutput.failure(result);
            return;
        }
        var branchPage = result.value();
        for (BranchSummary summary : branchPage.branches()) {
            var branch = summary.branch();
            var flags = summary.permissions();
            System.out.printf("%-30s %s  %s  files=%d  %s%s%s%n",
                    branch.name() + (branch.isDefault() ? " *" : ""),
                    branch.id(),
                    shortHash(branch.headCommitHash()),
                    summary.fileCount(),
                    flags.canRead() ? "r" : "-",
                    flags.canWrite() ? "w" : "-",
                    flags.canAdmin() ? "a" : "-");
        }
        System.out.println("──────────────────────────────────");
        System.out.println("Page " + branchPage.page() + ", " + branchPage.totalCount() + " branch(es) total"
                + (branchPage.hasNext() ? ", more available" : ""));
    }

    private static String shortHash(String hash) {
        return hash == null ? "-------" : hash.substring(0, Math.min(7, hash.length()));
    }
}
