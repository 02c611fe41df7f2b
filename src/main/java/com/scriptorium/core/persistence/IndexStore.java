package com.scriptorium.core.persistence;

import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPermission;
import com.scriptorium.core.model.FileRecord;
import com.scriptorium.core.model.RepositoryRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Relational index mirroring repositories, branches, file metadata and branch permissions.
 *
 * <p>Implementations throw {@link com.scriptorium.core.error.InfrastructureException}
 * when the backing store is unreachable.
 */
public interface IndexStore {

    Optional<RepositoryRecord> findRepository(UUID projectId);

    /**
     * Inserts the repository row, its main branch and the owner's grant in one transaction.
     */
    void createRepository(RepositoryRecord repository, Branch mainBranch, BranchPermission ownerGrant);

    void updateRepository(RepositoryRecord repository);

    Optional<Branch> findBranch(UUID branchId);

    /**
     * Finds a non-deleted branch of a project by exact name.
     */
    Optional<Branch> findBranchByName(UUID projectId, String name);

    /**
     * Non-deleted branches of a project ordered by creation time.
     */
    List<Branch> listBranches(UUID projectId, int offset, int limit);

    int countBranches(UUID projectId);

    /**
     * Inserts a branch row and its creator's grant in one transaction.
     */
    void insertBranch(Branch branch, BranchPermission creatorGrant);

    void updateBranchHead(UUID branchId, String commitHash, Instant at);

    Optional<BranchPermission> findPermission(UUID branchId, UUID userId);

    void upsertPermission(BranchPermission permission);

    List<BranchPermission> listPermissions(UUID branchId);

    /**
     * Finds the record for a path, including a soft-deleted one.
     */
    Optional<FileRecord> findFile(UUID branchId, String path);

    /**
     * Live (not soft-deleted) records of a branch ordered by path.
     */
    List<FileRecord> listFiles(UUID branchId);

    int countFiles(UUID branchId);

    /**
     * Inserts or replaces the record keyed by (branch id, path).
     */
    void saveFile(FileRecord file);

    /** True when the store survives a restart. */
    boolean isDurable();
}
