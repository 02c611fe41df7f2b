package com.scriptorium.core.subproject;

import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.files.FileStore;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.CommitResult;
import com.scriptorium.core.model.FileEntry;
import com.scriptorium.core.model.FileType;
import com.scriptorium.core.repository.RepositoryLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Groups a branch's files into LaTeX sub-projects: top-level directories holding
 * at least one {@code .tex} file. Directories under the legacy {@code file/}
 * root count too, as the compiler still reads them.
 */
@Service
public class SubprojectService {

    private static final Logger log = LoggerFactory.getLogger(SubprojectService.class);

    static final String DEFAULT_MAIN_FILE = "main.tex";

    private final FileStore files;

    public SubprojectService(FileStore files) {
        this.files = files;
    }

    public List<Subproject> listSubprojects(UUID branchId, Actor actor) {
        return new ArrayList<>(group(files.listFiles(branchId, actor)).values());
    }

    public Subproject getSubproject(UUID branchId, String name, Actor actor) {
        SubprojectNames.validate(name);
        Subproject subproject = group(files.listFiles(branchId, actor)).get(name);
        if (subproject == null) {
            throw new NotFoundException("LaTeX project not found: " + name);
        }
        return subproject;
    }

    /**
     * Creates {@code <name>/} in one commit. Supplied files are laid over the
     * rendered template, so callers can replace {@code main.tex} or add chapters.
     *
     * @param template article, report, book or beamer; blank means article
     * @param supplied file contents keyed by path relative to the sub-project, may be null
     */
    public Subproject createSubproject(UUID branchId, String name, String template, Map<String, String> supplied,
                                       String message, Actor actor) {
        SubprojectNames.validate(name);
        if (name.equals(RepositoryLayout.LEGACY_FILE_DIR)) {
            throw new ValidationException("'" + name + "' is reserved for legacy sources");
        }
        Map<String, String> contents = new LinkedHashMap<>(SubprojectTemplate.fromValue(template).render(name));
        if (supplied != null) {
            contents.putAll(supplied);
        }
        String commitMessage = message == null || message.isBlank() ? "Create LaTeX project: " + name : message;
        CommitResult commit = files.createDirectory(branchId, name, contents, commitMessage, actor);
        log.info("Created LaTeX project {} with {} file(s) at {}", name, contents.size(), commit.commitHash());
        return getSubproject(branchId, name, actor);
    }

    public CommitResult deleteSubproject(UUID branchId, String name, String message, Actor actor) {
        Subproject subproject = getSubproject(branchId, name, actor);
        String commitMessage = message == null || message.isBlank() ? "Delete LaTeX project: " + name : message;
        return files.deleteDirectory(branchId, subproject.directory(), commitMessage, actor);
    }

    /**
     * Builds sub-projects from a listing. A directory that exists both at the top
     * level and under {@code file/} resolves to the top-level one, as compilation does.
     */
    static Map<String, Subproject> group(List<FileEntry> entries) {
        Map<String, List<FileEntry>> byDirectory = new TreeMap<>();
        for (FileEntry entry : entries) {
            String directory = directoryOf(entry.path());
            if (directory != null) {
                byDirectory.computeIfAbsent(directory, d -> new ArrayList<>()).add(entry);
            }
        }

        Map<String, Subproject> subprojects = new TreeMap<>();
        for (Map.Entry<String, List<FileEntry>> group : byDirectory.entrySet()) {
            String directory = group.getKey();
            List<FileEntry> members = group.getValue();
            String mainFile = mainFile(directory, members);
            if (mainFile == null) {
                continue;
            }
            String name = directory.substring(directory.lastIndexOf('/') + 1);
            boolean legacy = directory.startsWith(RepositoryLayout.LEGACY_FILE_DIR + "/");
            if (legacy && subprojects.containsKey(name)) {
                continue;
            }
            Instant lastModified = members.stream()
                    .map(FileEntry::lastModified)
                    .filter(Objects::nonNull)
                    .max(Instant::compareTo)
                    .orElse(null);
            subprojects.put(name, new Subproject(name, directory, mainFile, members.size(), lastModified,
                    List.copyOf(members)));
        }
        return subprojects;
    }

    private static String directoryOf(String path) {
        String[] segments = path.split("/");
        if (segments.length < 2) {
            return null;
        }
        if (segments[0].equals(RepositoryLayout.LEGACY_FILE_DIR)) {
            return segments.length < 3 ? null : segments[0] + "/" + segments[1];
        }
        return segments[0];
    }

    private static String mainFile(String directory, List<FileEntry> members) {
        String fallback = null;
        for (FileEntry entry : members) {
            if (entry.type() != FileType.TEX) {
                continue;
            }
            String relative = entry.path().substring(directory.length() + 1);
            if (relative.equals(DEFAULT_MAIN_FILE)) {
                return relative;
            }
            if (fallback == null || relative.compareTo(fallback) < 0) {
                fallback = relative;
            }
        }
        return fallback;
    }
}
