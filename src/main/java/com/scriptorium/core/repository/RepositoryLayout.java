package com.scriptorium.core.repository;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Naming rules and fixed content of a project working directory.
 */
public final class RepositoryLayout {

    public static final String COMPILATIONS_DIR = "compilations";
    public static final String LEGACY_FILE_DIR = "file";
    public static final String INITIAL_COMMIT_MESSAGE = "Initial commit - Scriptorium project setup";

    public static final String GITIGNORE = """
            # LaTeX auxiliary files
            *.aux
            *.log
            *.out
            *.toc
            *.fdb_latexmk
            *.fls
            *.synctex.gz

            # Compilation workspaces
            compilations/

            # OS files
            .DS_Store
            Thumbs.db
            """;

    public static final String README = """
            # Scriptorium Project

            This is a Scriptorium project repository for collaborative LaTeX document editing.

            ## Getting Started

            This repository uses Git for version control and branch management.
            Each branch represents a different version or collaboration track of your documents.

            ## Branches

            - `main` - The main development branch
            """;

    private RepositoryLayout() {}

    /**
     * Lower-cases the name and replaces anything outside {@code [a-zA-Z0-9_-]} with an underscore.
     */
    public static String sanitize(String projectName) {
        return projectName.toLowerCase(Locale.ROOT).replaceAll("[^a-zA-Z0-9_-]", "_");
    }

    /**
     * {@code <root>/<sanitized name>_<first 8 chars of project id>}.
     */
    public static Path directoryFor(Path storageRoot, UUID projectId, String projectName) {
        return storageRoot.resolve(sanitize(projectName) + "_" + projectId.toString().substring(0, 8));
    }

    public static boolean isWorkingTree(Path repoPath) {
        return Files.exists(repoPath.resolve(".git"));
    }
}
