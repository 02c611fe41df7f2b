package com.scriptorium.core.files;

import java.nio.file.Path;
import java.util.List;

/**
 * Escalating ways of staging a single path, tried in declaration order.
 */
public enum StagingStrategy {

    RELATIVE_PATH {
        @Override
        List<String> addArguments(Path repoPath, String relative) {
            return List.of("add", "--", relative);
        }
    },
    ABSOLUTE_PATH {
        @Override
        List<String> addArguments(Path repoPath, String relative) {
            return List.of("add", "--", repoPath.resolve(relative).toAbsolutePath().toString());
        }
    },
    FORCED {
        @Override
        List<String> addArguments(Path repoPath, String relative) {
            return List.of("add", "-f", "--", relative);
        }
    };

    abstract List<String> addArguments(Path repoPath, String relative);

    /**
     * Strategy for a 1-based attempt; attempts past the last strategy repeat it.
     */
    static StagingStrategy forAttempt(int attempt) {
        StagingStrategy[] all = values();
        return all[Math.min(attempt, all.length) - 1];
    }
}
