package com.scriptorium.core.compile;

import com.scriptorium.core.repository.RepositoryLayout;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Places a sub-project's sources may live in, tried in declaration order.
 */
enum SourceLocation {

    CURRENT {
        @Override
        Path candidate(Path repoPath, String subprojectId) {
            return repoPath.resolve(subprojectId);
        }
    },
    LEGACY {
        @Override
        Path candidate(Path repoPath, String subprojectId) {
            return repoPath.resolve(RepositoryLayout.LEGACY_FILE_DIR).resolve(subprojectId);
        }
    };

    abstract Path candidate(Path repoPath, String subprojectId);

    static Optional<Path> resolve(Path repoPath, String subprojectId) {
        for (SourceLocation location : values()) {
            Path candidate = location.candidate(repoPath, subprojectId);
            if (Files.isDirectory(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
