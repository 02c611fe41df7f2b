package com.scriptorium.core.files;

import com.scriptorium.core.branch.BranchManager;
import com.scriptorium.core.error.ConflictException;
import com.scriptorium.core.error.ExternalToolException;
import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.ScriptoriumException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.git.GitCommandRunner;
import com.scriptorium.core.git.GitResult;
import com.scriptorium.core.lock.WorkingTreeLock;
import com.scriptorium.core.logging.MdcContext;
import com.scriptorium.core.metrics.ScriptoriumMetrics;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.CommitResult;
import com.scriptorium.core.model.FileContent;
import com.scriptorium.core.model.FileEntry;
import com.scriptorium.core.model.FileRecord;
import com.scriptorium.core.model.FileType;
import com.scriptorium.core.permission.PermissionIndex;
import com.scriptorium.core.persistence.IndexStore;
import com.scriptorium.core.repository.RepositoryLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Reads and commits files on a branch. Bytes live in Git; the index keeps
 * ownership and size metadata.
 */
@Service
public class FileStore {

    private static final Logger log = LoggerFactory.getLogger(FileStore.class);

    private final IndexStore store;
    private final BranchManager branches;
    private final PermissionIndex permissions;
    private final GitCommandRunner git;
    private final StagingProtocol staging;
    private final WorkingTreeLock lock;
    private final ScriptoriumMetrics metrics;

    public FileStore(IndexStore store, BranchManager branches, PermissionIndex permissions, GitCommandRunner git,
                     StagingProtocol staging, WorkingTreeLock lock, ScriptoriumMetrics metrics) {
        this.store = store;
        this.branches = branches;
        this.permissions = permissions;
        this.git = git;
        this.staging = staging;
        this.lock = lock;
        this.metrics = metrics;
    }

    /**
     * Writes and commits a file on a branch.
     *
     * @param content UTF-8 text; blank content is replaced by a placeholder
     * @param message commit message, defaults to {@code Update <path>}
     * @return the normalized path and the branch head after the write
     */
    public CommitResult writeFile(UUID branchId, String path, String content, String message, Actor actor) {
        String relative = PathPolicy.normalize(path);
        Branch branch = branches.requireBranch(branchId);
        permissions.requireWrite(branch, actor);

        return inBranchContext(branch, () -> {
            Path repoPath = branches.checkout(branch);
            PathPolicy.checkCollision(repoPath, relative);

            String actual = content == null || content.isBlank() ? PathPolicy.placeholder(relative) : content;
            byte[] bytes = actual.getBytes(StandardCharsets.UTF_8);
            writeBytes(repoPath.resolve(relative), bytes);

            if (isUnchanged(repoPath, relative)) {
                String head = git.revParse(repoPath, "HEAD");
                log.info("File {} on branch '{}' unchanged; nothing to commit", relative, branch.name());
                updateIndex("write", () -> {
                    branches.repairHead(repoPath, branch);
                    Optional<FileRecord> existing = store.findFile(branch.id(), relative);
                    if (existing.isEmpty() || existing.get().isDeleted() || existing.get().size() != bytes.length) {
                        saveRecord(branch, relative, bytes.length, actor, existing);
                    }
                });
                return new CommitResult(relative, head, false);
            }

            try {
                staging.stage(repoPath, relative);
            } catch (ConflictException e) {
                staging.unstage(repoPath, relative);
                throw e;
            }
            String commitMessage = message == null || message.isBlank() ? "Update " + relative : message;
            String hash = git.commitAs(repoPath, actor.authorName(), actor.authorEmail(), commitMessage);
            metrics.recordCommit("write");
            log.info("Committed {} on branch '{}' as {}", relative, branch.name(), hash);

            updateIndex("write", () -> {
                Instant now = Instant.now();
                store.updateBranchHead(branch.id(), hash, now);
                saveRecord(branch, relative, bytes.length, actor, store.findFile(branch.id(), relative));
            });
            return new CommitResult(relative, hash, true);
        });
    }

    /**
     * Reads a file from the working tree of a branch, falling back to the
     * legacy {@code file/<path>} location.
     */
    public FileContent readFile(UUID branchId, String path, Actor actor) {
        String relative = PathPolicy.normalize(path);
        Branch branch = branches.requireBranch(branchId);
        permissions.requireRead(branch, actor);

        return inBranchContext(branch, () -> {
            Path repoPath = branches.checkout(branch);
            branches.repairHead(repoPath, branch);

            Path target = repoPath.resolve(relative);
            if (!Files.isRegularFile(target)) {
                target = repoPath.resolve(RepositoryLayout.LEGACY_FILE_DIR).resolve(relative);
            }
            if (!Files.isRegularFile(target)) {
                throw new NotFoundException("File " + relative + " not found on branch '" + branch.name() + "'");
            }
            try {
                byte[] bytes = Files.readAllBytes(target);
                return new FileContent(relative, new String(bytes, StandardCharsets.UTF_8), bytes.length,
                        Files.getLastModifiedTime(target).toInstant());
            } catch (IOException e) {
                throw new ExternalToolException("Failed to read " + relative, e);
            }
        });
    }

    /**
     * Lists the union of files tracked by Git and files recorded in the index.
     */
    public List<FileEntry> listFiles(UUID branchId, Actor actor) {
        Branch branch = branches.requireBranch(branchId);
        permissions.requireRead(branch, actor);

        return inBranchContext(branch, () -> {
            Path repoPath = branches.checkout(branch);
            branches.repairHead(repoPath, branch);

            TreeSet<String> tracked = trackedPaths(repoPath);
            Map<String, FileRecord> records = new TreeMap<>();
            for (FileRecord record : store.listFiles(branch.id())) {
                records.put(record.path(), record);
            }

            TreeSet<String> all = new TreeSet<>(tracked);
            all.addAll(records.keySet());
            List<FileEntry> entries = new ArrayList<>();
            for (String relative : all) {
                FileRecord record = records.get(relative);
                Path file = repoPath.resolve(relative);
                boolean present = Files.isRegularFile(file);
                long size = present ? sizeOf(file) : (record != null ? record.size() : 0);
                Instant modified = present ? modifiedAt(file) : (record != null ? record.updatedAt() : null);

                if (record != null && present && record.size() != size) {
                    FileRecord repaired = record.withSize(size);
                    updateIndex("list", () -> store.saveFile(repaired));
                    record = repaired;
                }

                entries.add(new FileEntry(relative, PathPolicy.fileName(relative), FileType.fromPath(relative),
                        size, modified, tracked.contains(relative), record != null,
                        record != null ? record.id() : null,
                        record != null ? record.createdBy() : null,
                        record != null ? record.lastModifiedBy() : null));
            }
            return entries;
        });
    }

    /**
     * Removes a file from a branch with {@code git rm} and soft-deletes its record.
     */
    public CommitResult deleteFile(UUID branchId, String path, String message, Actor actor) {
        String relative = PathPolicy.normalize(path);
        Branch branch = branches.requireBranch(branchId);
        permissions.requireWrite(branch, actor);

        return inBranchContext(branch, () -> {
            Path repoPath = branches.checkout(branch);
            if (Files.isDirectory(repoPath.resolve(relative))) {
                throw new ValidationException("Path " + relative + " is a directory, not a file");
            }
            Optional<FileRecord> record = store.findFile(branch.id(), relative).filter(r -> !r.isDeleted());

            GitResult known = git.exec(repoPath, "ls-files", "--error-unmatch", "--", relative);
            if (!known.success()) {
                if (record.isEmpty()) {
                    throw new NotFoundException("File " + relative + " not found on branch '" + branch.name() + "'");
                }
                log.info("File {} is not tracked on branch '{}'; soft-deleting its record only", relative, branch.name());
                updateIndex("delete", () -> store.saveFile(record.get().softDeleted(actor.id(), Instant.now())));
                return new CommitResult(relative, git.revParse(repoPath, "HEAD"), false);
            }

            git.run(repoPath, "rm", "-q", "--", relative);
            String commitMessage = message == null || message.isBlank() ? "Delete " + relative : message;
            String hash = git.commitAs(repoPath, actor.authorName(), actor.authorEmail(), commitMessage);
            metrics.recordCommit("delete");
            log.info("Deleted {} on branch '{}' as {}", relative, branch.name(), hash);

            updateIndex("delete", () -> {
                Instant now = Instant.now();
                store.updateBranchHead(branch.id(), hash, now);
                record.ifPresent(r -> store.saveFile(r.softDeleted(actor.id(), now)));
            });
            return new CommitResult(relative, hash, true);
        });
    }

    /**
     * Writes a new directory of files on a branch in a single commit.
     *
     * @param files contents keyed by path relative to {@code directory}
     * @throws ConflictException with reason PATH_COLLISION when Git already tracks files under the directory
     */
    public CommitResult createDirectory(UUID branchId, String directory, Map<String, String> files, String message,
                                        Actor actor) {
        String prefix = PathPolicy.normalize(directory);
        if (files == null || files.isEmpty()) {
            throw new ValidationException("Directory " + prefix + " needs at least one file");
        }
        Map<String, byte[]> contents = new TreeMap<>();
        for (Map.Entry<String, String> file : files.entrySet()) {
            String relative = PathPolicy.normalize(prefix + "/" + PathPolicy.normalize(file.getKey()));
            String text = file.getValue() == null || file.getValue().isBlank()
                    ? PathPolicy.placeholder(relative) : file.getValue();
            contents.put(relative, text.getBytes(StandardCharsets.UTF_8));
        }
        Branch branch = branches.requireBranch(branchId);
        permissions.requireWrite(branch, actor);

        return inBranchContext(branch, () -> {
            Path repoPath = branches.checkout(branch);
            if (!trackedPaths(repoPath, prefix).isEmpty()) {
                throw new ConflictException(ConflictException.Reason.PATH_COLLISION,
                        "Directory " + prefix + " already exists on branch '" + branch.name() + "'");
            }
            for (String relative : contents.keySet()) {
                PathPolicy.checkCollision(repoPath, relative);
            }

            List<String> staged = new ArrayList<>();
            try {
                for (Map.Entry<String, byte[]> file : contents.entrySet()) {
                    writeBytes(repoPath.resolve(file.getKey()), file.getValue());
                    staged.add(file.getKey());
                    staging.stage(repoPath, file.getKey());
                }
            } catch (ScriptoriumException e) {
                for (String relative : staged) {
                    staging.unstage(repoPath, relative);
                    deleteQuietly(repoPath.resolve(relative));
                }
                throw e;
            }

            String commitMessage = message == null || message.isBlank() ? "Create " + prefix : message;
            String hash = git.commitAs(repoPath, actor.authorName(), actor.authorEmail(), commitMessage);
            metrics.recordCommit("create_directory");
            log.info("Created {} with {} file(s) on branch '{}' as {}", prefix, contents.size(), branch.name(), hash);

            updateIndex("create_directory", () -> {
                store.updateBranchHead(branch.id(), hash, Instant.now());
                contents.forEach((relative, bytes) ->
                        saveRecord(branch, relative, bytes.length, actor, store.findFile(branch.id(), relative)));
            });
            return new CommitResult(prefix, hash, true);
        });
    }

    /**
     * Removes a directory and everything under it with {@code git rm -r} and
     * soft-deletes the records beneath it.
     */
    public CommitResult deleteDirectory(UUID branchId, String directory, String message, Actor actor) {
        String prefix = PathPolicy.normalize(directory);
        Branch branch = branches.requireBranch(branchId);
        permissions.requireWrite(branch, actor);

        return inBranchContext(branch, () -> {
            Path repoPath = branches.checkout(branch);
            if (Files.isRegularFile(repoPath.resolve(prefix))) {
                throw new ValidationException("Path " + prefix + " is a file, not a directory");
            }
            List<FileRecord> records = store.listFiles(branch.id()).stream()
                    .filter(r -> r.path().startsWith(prefix + "/"))
                    .toList();
            TreeSet<String> tracked = trackedPaths(repoPath, prefix);
            if (tracked.isEmpty()) {
                if (records.isEmpty()) {
                    throw new NotFoundException("Directory " + prefix + " not found on branch '" + branch.name() + "'");
                }
                log.info("Directory {} is not tracked on branch '{}'; soft-deleting its records only",
                        prefix, branch.name());
                updateIndex("delete_directory", () -> softDelete(records, actor, Instant.now()));
                return new CommitResult(prefix, git.revParse(repoPath, "HEAD"), false);
            }

            git.run(repoPath, "rm", "-r", "-q", "--", prefix);
            String commitMessage = message == null || message.isBlank() ? "Delete " + prefix : message;
            String hash = git.commitAs(repoPath, actor.authorName(), actor.authorEmail(), commitMessage);
            metrics.recordCommit("delete_directory");
            log.info("Deleted {} ({} file(s)) on branch '{}' as {}", prefix, tracked.size(), branch.name(), hash);

            updateIndex("delete_directory", () -> {
                Instant now = Instant.now();
                store.updateBranchHead(branch.id(), hash, now);
                softDelete(records, actor, now);
            });
            return new CommitResult(prefix, hash, true);
        });
    }

    private void softDelete(List<FileRecord> records, Actor actor, Instant at) {
        for (FileRecord record : records) {
            store.saveFile(record.softDeleted(actor.id(), at));
        }
    }

    private <T> T inBranchContext(Branch branch, Supplier<T> work) {
        MdcContext.setBranch(branch.projectId(), branch.id());
        try {
            return lock.withLock(branch.projectId(), work);
        } finally {
            MdcContext.clear();
        }
    }

    private void saveRecord(Branch branch, String relative, long size, Actor actor, Optional<FileRecord> existing) {
        Instant now = Instant.now();
        FileRecord record = existing
                .map(r -> r.modified(size, actor.id(), now))
                .orElseGet(() -> new FileRecord(UUID.randomUUID(), branch.projectId(), branch.id(), relative,
                        PathPolicy.fileName(relative), FileType.fromPath(relative), size,
                        FileRecord.DEFAULT_ENCODING, actor.id(), actor.id(), now, now, null));
        store.saveFile(record);
    }

    /**
     * Index writes after a commit: Git is authoritative, so failures are logged
     * and left for the next read to reconcile.
     */
    private void updateIndex(String operation, Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            metrics.recordIndexLag(operation);
            log.warn("Index update after {} failed; Git remains authoritative: {}", operation, e.getMessage(), e);
        }
    }

    /**
     * True when the path is tracked and the working-tree bytes match HEAD.
     * Ignored untracked files also report an empty status, so tracking is checked first.
     */
    private boolean isUnchanged(Path repoPath, String relative) {
        if (!git.exec(repoPath, "ls-files", "--error-unmatch", "--", relative).success()) {
            return false;
        }
        return git.run(repoPath, "status", "--porcelain", "--", relative).isEmpty();
    }

    private TreeSet<String> trackedPaths(Path repoPath, String... pathspec) {
        List<String> args = new ArrayList<>(List.of("ls-files", "-z", "--"));
        args.addAll(List.of(pathspec));
        GitResult result = git.exec(repoPath, args.toArray(String[]::new));
        if (!result.success()) {
            throw new ExternalToolException("git ls-files failed: " + result.diagnostic(), result.exitCode());
        }
        TreeSet<String> paths = new TreeSet<>();
        for (String entry : result.stdout().split("\0")) {
            if (!entry.isEmpty()) {
                paths.add(entry);
            }
        }
        return paths;
    }

    private static void writeBytes(Path target, byte[] bytes) {
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new ExternalToolException("Failed to write " + target.getFileName(), e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove {} after a failed write: {}", file, e.getMessage());
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private static Instant modifiedAt(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return null;
        }
    }
}
