package com.scriptorium.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Index row describing the Git working directory owned by a project.
 *
 * @param id              row id
 * @param projectId       owning project, unique
 * @param repoPath        absolute filesystem path of the working directory
 * @param defaultBranchId id of the "main" branch row
 * @param lastCommitHash  head of the default branch at the last initialization
 * @param initialized     true once the initial commit exists
 * @param createdAt       creation time
 * @param updatedAt       last update time
 */
public record RepositoryRecord(
    UUID id,
    UUID projectId,
    String repoPath,
    UUID defaultBranchId,
    String lastCommitHash,
    boolean initialized,
    Instant createdAt,
    Instant updatedAt
) {
    public RepositoryRecord withLastCommit(String hash, Instant at) {
        return new RepositoryRecord(id, projectId, repoPath, defaultBranchId, hash, initialized, createdAt, at);
    }
}
