package com.scriptorium.core.persistence;

import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPermission;
import com.scriptorium.core.model.BranchStatus;
import com.scriptorium.core.model.FileRecord;
import com.scriptorium.core.model.RepositoryRecord;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Map-backed {@link IndexStore} for development and tests.
 * State is lost on restart.
 */
public class InMemoryIndexStore implements IndexStore {

    private final Map<UUID, RepositoryRecord> repositoriesByProject = new HashMap<>();
    private final Map<UUID, Branch> branches = new LinkedHashMap<>();
    private final Map<PermissionKey, BranchPermission> permissions = new LinkedHashMap<>();
    private final Map<FileKey, FileRecord> files = new HashMap<>();

    private record PermissionKey(UUID branchId, UUID userId) {}

    private record FileKey(UUID branchId, String path) {}

    @Override
    public synchronized Optional<RepositoryRecord> findRepository(UUID projectId) {
        return Optional.ofNullable(repositoriesByProject.get(projectId));
    }

    @Override
    public synchronized void createRepository(RepositoryRecord repository, Branch mainBranch,
                                              BranchPermission ownerGrant) {
        if (repositoriesByProject.containsKey(repository.projectId())) {
            throw new IllegalStateException("Repository already exists for project " + repository.projectId());
        }
        repositoriesByProject.put(repository.projectId(), repository);
        branches.put(mainBranch.id(), mainBranch);
        upsertPermission(ownerGrant);
    }

    @Override
    public synchronized void updateRepository(RepositoryRecord repository) {
        repositoriesByProject.put(repository.projectId(), repository);
    }

    @Override
    public synchronized Optional<Branch> findBranch(UUID branchId) {
        return Optional.ofNullable(branches.get(branchId));
    }

    @Override
    public synchronized Optional<Branch> findBranchByName(UUID projectId, String name) {
        return branches.values().stream()
                .filter(b -> b.projectId().equals(projectId))
                .filter(b -> b.status() != BranchStatus.DELETED)
                .filter(b -> b.name().equals(name))
                .findFirst();
    }

    @Override
    public synchronized List<Branch> listBranches(UUID projectId, int offset, int limit) {
        return branches.values().stream()
                .filter(b -> b.projectId().equals(projectId))
                .filter(b -> b.status() != BranchStatus.DELETED)
                .sorted(Comparator.comparing(Branch::createdAt).thenComparing(Branch::name))
                .skip(offset)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized int countBranches(UUID projectId) {
        return (int) branches.values().stream()
                .filter(b -> b.projectId().equals(projectId))
                .filter(b -> b.status() != BranchStatus.DELETED)
                .count();
    }

    @Override
    public synchronized void insertBranch(Branch branch, BranchPermission creatorGrant) {
        if (branches.containsKey(branch.id())) {
            throw new IllegalStateException("Branch already exists: " + branch.id());
        }
        branches.put(branch.id(), branch);
        upsertPermission(creatorGrant);
    }

    @Override
    public synchronized void updateBranchHead(UUID branchId, String commitHash, Instant at) {
        Branch branch = branches.get(branchId);
        if (branch != null) {
            branches.put(branchId, branch.withHead(commitHash, at));
        }
    }

    @Override
    public synchronized Optional<BranchPermission> findPermission(UUID branchId, UUID userId) {
        return Optional.ofNullable(permissions.get(new PermissionKey(branchId, userId)));
    }

    @Override
    public synchronized void upsertPermission(BranchPermission permission) {
        permissions.put(new PermissionKey(permission.branchId(), permission.userId()), permission);
    }

    @Override
    public synchronized List<BranchPermission> listPermissions(UUID branchId) {
        return permissions.values().stream()
                .filter(p -> p.branchId().equals(branchId))
                .toList();
    }

    @Override
    public synchronized Optional<FileRecord> findFile(UUID branchId, String path) {
        return Optional.ofNullable(files.get(new FileKey(branchId, path)));
    }

    @Override
    public synchronized List<FileRecord> listFiles(UUID branchId) {
        return files.values().stream()
                .filter(f -> f.branchId().equals(branchId))
                .filter(f -> !f.isDeleted())
                .sorted(Comparator.comparing(FileRecord::path))
                .toList();
    }

    @Override
    public synchronized int countFiles(UUID branchId) {
        return listFiles(branchId).size();
    }

    @Override
    public synchronized void saveFile(FileRecord file) {
        var key = new FileKey(file.branchId(), file.path());
        FileRecord existing = files.get(key);
        if (existing != null) {
            files.put(key, new FileRecord(existing.id(), existing.projectId(), existing.branchId(),
                    existing.path(), file.name(), file.type(), file.size(), file.encoding(),
                    existing.createdBy(), file.lastModifiedBy(), existing.createdAt(),
                    file.updatedAt(), file.deletedAt()));
        } else {
            files.put(key, file);
        }
    }

    @Override
    public boolean isDurable() {
        return false;
    }
}
