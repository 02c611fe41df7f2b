package com.scriptorium.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Index row mirroring a Git branch of a project repository.
 * The cached {@code headCommitHash} equals the ref head after every successful write.
 */
public record Branch(
    UUID id,
    UUID projectId,
    String name,
    String description,
    UUID sourceBranchId,
    String headCommitHash,
    BranchStatus status,
    boolean isDefault,
    boolean isProtected,
    UUID createdBy,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String MAIN = "main";

    public Branch withHead(String hash, Instant at) {
        return new Branch(id, projectId, name, description, sourceBranchId, hash,
                status, isDefault, isProtected, createdBy, createdAt, at);
    }
}
