package com.scriptorium.core.subproject;

import com.scriptorium.core.model.FileEntry;

import java.time.Instant;
import java.util.List;

/**
 * A LaTeX document living in its own directory of a branch.
 *
 * @param directory repository path of the sources, {@code name} or {@code file/name} for legacy layouts
 * @param mainFile  entry point relative to {@code directory}
 * @param files     entries whose paths are relative to the repository root
 */
public record Subproject(
    String name,
    String directory,
    String mainFile,
    int fileCount,
    Instant lastModified,
    List<FileEntry> files
) {}
