package com.scriptorium.core.repository;

import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.error.ExternalToolException;
import com.scriptorium.core.error.InconsistentStateException;
import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.git.GitCommandRunner;
import com.scriptorium.core.lock.WorkingTreeLock;
import com.scriptorium.core.logging.MdcContext;
import com.scriptorium.core.metrics.ScriptoriumMetrics;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPermission;
import com.scriptorium.core.model.BranchStatus;
import com.scriptorium.core.model.InitializationResult;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.model.RepositoryRecord;
import com.scriptorium.core.persistence.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Owns the one Git working directory of each project.
 *
 * <p>{@link #initialize} is idempotent. When the index row outlives its
 * directory the repository is rebuilt at the stored path, keeping the stored ids.
 */
@Service
public class RepositoryManager {

    private static final Logger log = LoggerFactory.getLogger(RepositoryManager.class);

    private final IndexStore store;
    private final GitCommandRunner git;
    private final ScriptoriumProperties properties;
    private final WorkingTreeLock lock;
    private final ScriptoriumMetrics metrics;

    public RepositoryManager(IndexStore store, GitCommandRunner git, ScriptoriumProperties properties,
                             WorkingTreeLock lock, ScriptoriumMetrics metrics) {
        this.store = store;
        this.git = git;
        this.properties = properties;
        this.lock = lock;
        this.metrics = metrics;
    }

    /**
     * Creates the project's repository, or returns the existing one.
     *
     * @param projectId   owning project
     * @param projectName used for the directory name
     * @param actor       receives full access on the main branch
     */
    public InitializationResult initialize(UUID projectId, String projectName, Actor actor) {
        if (projectId == null) {
            throw new ValidationException("Project id is required");
        }
        if (projectName == null || projectName.isBlank()) {
            throw new ValidationException("Project name is required");
        }
        MdcContext.setProject(projectId);
        try {
            return lock.withLock(projectId, () -> {
                Optional<RepositoryRecord> existing = store.findRepository(projectId);
                if (existing.isPresent()) {
                    RepositoryRecord repository = ensureWorkingTree(existing.get());
                    log.info("Git repository already exists for project {} at {}", projectId, repository.repoPath());
                    return new InitializationResult(repository.repoPath(), repository.defaultBranchId(), false);
                }
                return create(projectId, projectName, actor);
            });
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Returns the initialized repository of a project.
     */
    public RepositoryRecord requireRepository(UUID projectId) {
        RepositoryRecord repository = store.findRepository(projectId)
                .orElseThrow(() -> new NotFoundException("No repository for project " + projectId));
        if (!repository.initialized()) {
            throw new NotFoundException("Repository for project " + projectId + " is not initialized");
        }
        return repository;
    }

    /**
     * Rebuilds the working directory when it has gone missing.
     *
     * @return the repository row, refreshed when a rebuild happened
     */
    public RepositoryRecord ensureWorkingTree(RepositoryRecord repository) {
        Path repoPath = Path.of(repository.repoPath());
        if (RepositoryLayout.isWorkingTree(repoPath)) {
            return repository;
        }
        return lock.withLock(repository.projectId(), () -> {
            if (RepositoryLayout.isWorkingTree(repoPath)) {
                return repository;
            }
            return selfHeal(repository, repoPath);
        });
    }

    private RepositoryRecord selfHeal(RepositoryRecord repository, Path repoPath) {
        log.warn("Repository directory {} for project {} is missing; rebuilding", repoPath, repository.projectId());
        String head;
        try {
            head = buildWorkingTree(repoPath);
        } catch (ExternalToolException e) {
            throw e;
        } catch (UncheckedIOException e) {
            throw new ExternalToolException("Failed to rebuild repository at " + repoPath, e);
        }

        Instant now = Instant.now();
        RepositoryRecord healed = repository.withLastCommit(head, now);
        store.updateRepository(healed);
        if (repository.defaultBranchId() != null) {
            store.updateBranchHead(repository.defaultBranchId(), head, now);
        }
        metrics.recordSelfHeal();
        log.info("Rebuilt repository for project {} at {} (head {})", repository.projectId(), repoPath, head);
        return healed;
    }

    private InitializationResult create(UUID projectId, String projectName, Actor actor) {
        Path repoPath = RepositoryLayout.directoryFor(properties.getStorageRoot(), projectId, projectName);

        if (Files.exists(repoPath)) {
            return adopt(projectId, repoPath, actor);
        }

        try {
            String head = buildWorkingTree(repoPath);
            InitializationResult result = insertRows(projectId, repoPath, head, actor);
            metrics.recordCommit("init");
            log.info("Initialized repository for project {} at {}", projectId, repoPath);
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to initialize repository for project {}; removing {}", projectId, repoPath, e);
            deleteRecursively(repoPath);
            if (e instanceof UncheckedIOException io) {
                throw new ExternalToolException("Failed to initialize repository: " + io.getCause().getMessage(), io);
            }
            throw e;
        }
    }

    /**
     * A directory without an index row is left over from a store that lost its
     * rows. A valid repository with a main branch is re-indexed; anything else is refused.
     */
    private InitializationResult adopt(UUID projectId, Path repoPath, Actor actor) {
        if (!RepositoryLayout.isWorkingTree(repoPath)) {
            throw new InconsistentStateException(
                    "Directory " + repoPath + " exists but is not a Git repository");
        }
        String head = git.branchHead(repoPath, Branch.MAIN)
                .orElseThrow(() -> new InconsistentStateException(
                        "Repository at " + repoPath + " has no main branch"));
        log.warn("Re-indexing existing repository at {} for project {}", repoPath, projectId);
        InitializationResult result = insertRows(projectId, repoPath, head, actor);
        return new InitializationResult(result.repoPath(), result.mainBranchId(), false);
    }

    private InitializationResult insertRows(UUID projectId, Path repoPath, String head, Actor actor) {
        Instant now = Instant.now();
        UUID mainBranchId = UUID.randomUUID();
        var repository = new RepositoryRecord(UUID.randomUUID(), projectId, repoPath.toString(),
                mainBranchId, head, true, now, now);
        var main = new Branch(mainBranchId, projectId, Branch.MAIN, "Main development branch", null, head,
                BranchStatus.ACTIVE, true, false, actor.id(), now, now);
        var grant = new BranchPermission(mainBranchId, actor.id(), PermissionFlags.FULL, actor.id(), now);
        store.createRepository(repository, main, grant);
        return new InitializationResult(repoPath.toString(), mainBranchId, true);
    }

    /**
     * Creates the directory, initializes Git on {@code main} and makes the initial commit.
     *
     * @return hash of the initial commit
     */
    private String buildWorkingTree(Path repoPath) {
        try {
            Files.createDirectories(repoPath);
            git.run(repoPath, "init");
            git.run(repoPath, "symbolic-ref", "HEAD", "refs/heads/" + Branch.MAIN);
            Files.writeString(repoPath.resolve(".gitignore"), RepositoryLayout.GITIGNORE, StandardCharsets.UTF_8);
            Files.writeString(repoPath.resolve("README.md"), RepositoryLayout.README, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        git.run(repoPath, "add", ".gitignore", "README.md");
        return git.commitAs(repoPath, properties.getSystemName(), properties.getSystemEmail(),
                RepositoryLayout.INITIAL_COMMIT_MESSAGE);
    }

    private static void deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", path, e.getMessage());
        }
    }
}
