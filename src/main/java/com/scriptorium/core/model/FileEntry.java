package com.scriptorium.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of a branch file listing: Git existence merged with index ownership.
 * Ownership fields are null for files tracked by Git but absent from the index.
 *
 * @param tracked true when {@code git ls-files} reports the path
 * @param indexed true when a live {@link FileRecord} exists for the path
 */
public record FileEntry(
    String path,
    String name,
    FileType type,
    long size,
    Instant lastModified,
    boolean tracked,
    boolean indexed,
    UUID fileId,
    UUID createdBy,
    UUID lastModifiedBy
) {}
