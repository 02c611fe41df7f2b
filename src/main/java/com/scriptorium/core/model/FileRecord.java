package com.scriptorium.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Metadata of a file committed through the engine. The bytes live in Git only.
 *
 * @param path      POSIX path relative to the repository root, unique within a branch
 * @param size      byte length of the blob at HEAD, absent an in-flight write
 * @param deletedAt soft-delete marker, null while the file is live
 */
public record FileRecord(
    UUID id,
    UUID projectId,
    UUID branchId,
    String path,
    String name,
    FileType type,
    long size,
    String encoding,
    UUID createdBy,
    UUID lastModifiedBy,
    Instant createdAt,
    Instant updatedAt,
    Instant deletedAt
) {
    public static final String DEFAULT_ENCODING = "utf-8";

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public FileRecord modified(long newSize, UUID modifier, Instant at) {
        return new FileRecord(id, projectId, branchId, path, name, type, newSize, encoding,
                createdBy, modifier, createdAt, at, null);
    }

    public FileRecord withSize(long newSize) {
        return new FileRecord(id, projectId, branchId, path, name, type, newSize, encoding,
                createdBy, lastModifiedBy, createdAt, updatedAt, deletedAt);
    }

    public FileRecord softDeleted(UUID modifier, Instant at) {
        return new FileRecord(id, projectId, branchId, path, name, type, size, encoding,
                createdBy, modifier, createdAt, at, at);
    }
}
