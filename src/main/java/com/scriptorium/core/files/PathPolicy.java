package com.scriptorium.core.files;

import com.scriptorium.core.error.ConflictException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.repository.RepositoryLayout;

import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Normalization and safety checks for repository-relative file paths.
 */
public final class PathPolicy {

    private static final String TEX_PLACEHOLDER = "% Empty LaTeX file\n% Add your content here\n";

    private PathPolicy() {}

    /**
     * Strips leading slashes and rejects paths that escape the working tree or
     * touch reserved directories.
     *
     * @return the POSIX path relative to the repository root
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("File path is required");
        }
        String relative = path.strip().replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        while (relative.contains("//")) {
            relative = relative.replace("//", "/");
        }
        if (relative.endsWith("/")) {
            relative = relative.substring(0, relative.length() - 1);
        }
        if (relative.isEmpty()) {
            throw new ValidationException("File path is required");
        }
        if (relative.indexOf('\0') >= 0) {
            throw new ValidationException("File path contains a NUL character");
        }
        for (String segment : relative.split("/")) {
            if (segment.equals("..") || segment.equals(".")) {
                throw new ValidationException("File path must not contain '" + segment + "' segments: " + path);
            }
            if (segment.equals(".git")) {
                throw new ValidationException("File path must not be inside '.git/': " + path);
            }
        }
        if (relative.equals(RepositoryLayout.COMPILATIONS_DIR)
                || relative.startsWith(RepositoryLayout.COMPILATIONS_DIR + "/")) {
            throw new ValidationException("File path must not be inside '" + RepositoryLayout.COMPILATIONS_DIR + "/': " + path);
        }
        return relative;
    }

    /**
     * Fails when a regular file sits at a parent prefix of {@code relative}, or
     * a directory sits at {@code relative} itself.
     */
    public static void checkCollision(Path repoPath, String relative) {
        String[] segments = relative.split("/");
        Path current = repoPath;
        for (int i = 0; i < segments.length - 1; i++) {
            current = current.resolve(segments[i]);
            if (Files.exists(current, LinkOption.NOFOLLOW_LINKS) && !Files.isDirectory(current, LinkOption.NOFOLLOW_LINKS)) {
                String prefix = String.join("/", Arrays.copyOfRange(segments, 0, i + 1));
                throw new ConflictException(ConflictException.Reason.PATH_COLLISION,
                        "Cannot create directory '" + prefix + "' because a file with the same name already exists");
            }
        }
        if (Files.isDirectory(repoPath.resolve(relative), LinkOption.NOFOLLOW_LINKS)) {
            throw new ConflictException(ConflictException.Reason.PATH_COLLISION,
                    "Cannot write file '" + relative + "' because a directory with the same name already exists");
        }
    }

    /**
     * Content written in place of blank content.
     */
    public static String placeholder(String relative) {
        if (relative.endsWith(".tex")) {
            return TEX_PLACEHOLDER;
        }
        String name = relative.substring(relative.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 && dot < name.length() - 1 ? name.substring(dot + 1) : "file";
        return "% Empty " + extension + "\n";
    }

    public static String fileName(String relative) {
        return relative.substring(relative.lastIndexOf('/') + 1);
    }
}
