package com.scriptorium.core.branch;

import com.scriptorium.core.error.ConflictException;
import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.PermissionDeniedException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.git.GitCommandRunner;
import com.scriptorium.core.lock.WorkingTreeLock;
import com.scriptorium.core.logging.MdcContext;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPage;
import com.scriptorium.core.model.BranchPermission;
import com.scriptorium.core.model.BranchStatus;
import com.scriptorium.core.model.BranchSummary;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.model.RepositoryRecord;
import com.scriptorium.core.permission.PermissionIndex;
import com.scriptorium.core.persistence.IndexStore;
import com.scriptorium.core.repository.RepositoryLayout;
import com.scriptorium.core.repository.RepositoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Mirrors a project's Git branches as index rows with cached head hashes.
 */
@Service
public class BranchManager {

    private static final Logger log = LoggerFactory.getLogger(BranchManager.class);

    static final int MAX_PAGE_SIZE = 100;

    private final IndexStore store;
    private final RepositoryManager repositories;
    private final PermissionIndex permissions;
    private final GitCommandRunner git;
    private final WorkingTreeLock lock;

    public BranchManager(IndexStore store, RepositoryManager repositories, PermissionIndex permissions,
                         GitCommandRunner git, WorkingTreeLock lock) {
        this.store = store;
        this.repositories = repositories;
        this.permissions = permissions;
        this.git = git;
        this.lock = lock;
    }

    /**
     * Creates a branch from {@code sourceBranch} (default {@code main}).
     * The creator receives full access on the new branch.
     */
    public Branch createBranch(UUID projectId, String name, String sourceBranch, String description, Actor actor) {
        BranchNames.validate(name);
        String sourceName = sourceBranch == null || sourceBranch.isBlank() ? Branch.MAIN : sourceBranch;
        MdcContext.setProject(projectId);
        try {
            RepositoryRecord repository = repositories.requireRepository(projectId);
            Branch source = store.findBranchByName(projectId, sourceName)
                    .orElseThrow(() -> new NotFoundException("Source branch '" + sourceName + "' not found"));
            if (!permissions.get(source.id(), actor.id()).allowsWrite()) {
                throw new PermissionDeniedException(
                        "No write permission on source branch '" + sourceName + "'");
            }
            requireNewName(projectId, name);

            return lock.withLock(projectId, () -> {
                // a concurrent create may have won the name since the first check
                requireNewName(projectId, name);
                Path repoPath = workingTree(repository);
                if (git.branchHead(repoPath, name).isPresent()) {
                    throw new ConflictException(ConflictException.Reason.DUPLICATE_BRANCH,
                            "Branch '" + name + "' already exists in the repository");
                }
                ensureRef(repoPath, source);
                git.checkout(repoPath, source.name());
                git.run(repoPath, "checkout", "-b", name);
                String head = git.revParse(repoPath, "HEAD");

                Instant now = Instant.now();
                var branch = new Branch(UUID.randomUUID(), projectId, name, description, source.id(), head,
                        BranchStatus.ACTIVE, false, false, actor.id(), now, now);
                store.insertBranch(branch,
                        new BranchPermission(branch.id(), actor.id(), PermissionFlags.FULL, actor.id(), now));
                log.info("Created branch '{}' from '{}' at {} in project {}", name, source.name(), head, projectId);
                return branch;
            });
        } finally {
            MdcContext.clear();
        }
    }

    private void requireNewName(UUID projectId, String name) {
        if (store.findBranchByName(projectId, name).isPresent()) {
            throw new ConflictException(ConflictException.Reason.DUPLICATE_BRANCH,
                    "Branch '" + name + "' already exists");
        }
    }

    /**
     * Lists non-deleted branches ordered by creation time, with file counts and
     * the caller's effective permissions.
     *
     * @param page 1-based page number
     * @param size page size, 1 to 100
     */
    public BranchPage listBranches(UUID projectId, int page, int size, Actor actor) {
        if (page < 1) {
            throw new ValidationException("Page must be at least 1");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        RepositoryRecord repository = repositories.requireRepository(projectId);
        Path repoPath = Path.of(repository.repoPath());
        boolean canRepair = RepositoryLayout.isWorkingTree(repoPath);

        int total = store.countBranches(projectId);
        List<BranchSummary> summaries = new ArrayList<>();
        for (Branch branch : store.listBranches(projectId, (page - 1) * size, size)) {
            Branch current = canRepair ? repairHead(repoPath, branch) : branch;
            summaries.add(new BranchSummary(current,
                    store.countFiles(branch.id()),
                    permissions.get(branch.id(), actor.id()).effective()));
        }
        return BranchPage.of(summaries, total, page, size);
    }

    /**
     * Returns a live (not deleted) branch.
     */
    public Branch requireBranch(UUID branchId) {
        return store.findBranch(branchId)
                .filter(b -> b.status() != BranchStatus.DELETED)
                .orElseThrow(() -> new NotFoundException("Branch not found: " + branchId));
    }

    /**
     * Prepares the working tree of the branch's project for work on the branch:
     * rebuilds a missing repository, recreates a missing ref from {@code main}
     * and checks the branch out.
     *
     * @return the repository working directory
     */
    public Path checkout(Branch branch) {
        RepositoryRecord repository = repositories.requireRepository(branch.projectId());
        Path repoPath = workingTree(repository);
        ensureRef(repoPath, branch);
        git.checkout(repoPath, branch.name());
        return repoPath;
    }

    /**
     * Rewrites the cached head when it disagrees with the ref.
     */
    public Branch repairHead(Path repoPath, Branch branch) {
        Optional<String> actual = git.branchHead(repoPath, branch.name());
        if (actual.isEmpty() || actual.get().equals(branch.headCommitHash())) {
            return branch;
        }
        log.info("Cached head of branch '{}' was {}, ref is {}; repairing",
                branch.name(), branch.headCommitHash(), actual.get());
        Instant now = Instant.now();
        store.updateBranchHead(branch.id(), actual.get(), now);
        return branch.withHead(actual.get(), now);
    }

    private Path workingTree(RepositoryRecord repository) {
        return Path.of(repositories.ensureWorkingTree(repository).repoPath());
    }

    private void ensureRef(Path repoPath, Branch branch) {
        if (git.branchHead(repoPath, branch.name()).isPresent()) {
            return;
        }
        log.warn("Branch ref '{}' is missing in {}; recreating from {}", branch.name(), repoPath, Branch.MAIN);
        git.run(repoPath, "branch", branch.name(), Branch.MAIN);
    }
}
