package com.scriptorium.core.files;

import com.scriptorium.core.EngineFixture;
import com.scriptorium.core.error.ConflictException;
import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.PermissionDeniedException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.FileEntry;
import com.scriptorium.core.model.FileRecord;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.repository.RepositoryLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileStoreTest {

    @TempDir
    Path root;

    private EngineFixture fx;
    private final UUID projectId = UUID.randomUUID();
    private final Actor owner = EngineFixture.actor("Ada");
    private Path repo;
    private UUID mainId;

    @BeforeEach
    void setUp() {
        assumeTrue(EngineFixture.gitAvailable(), "git not installed");
        fx = new EngineFixture(root);
        var init = fx.repositories.initialize(projectId, "Thesis", owner);
        repo = Path.of(init.repoPath());
        mainId = init.mainBranchId();
    }

    @Test
    @DisplayName("Thesis: successive writes produce new commits and reads follow")
    void thesisScenario() {
        assertTrue(repo.getFileName().toString().matches("thesis_[0-9a-f]{8}"));

        var first = fx.files.writeFile(mainId, "intro.tex", "Hello", null, owner);
        assertEquals("Hello", fx.files.readFile(mainId, "intro.tex", owner).content());

        var second = fx.files.writeFile(mainId, "intro.tex", "Hello world", null, owner);
        assertNotEquals(first.commitHash(), second.commitHash());
        assertEquals("Hello world", fx.files.readFile(mainId, "intro.tex", owner).content());
    }

    @Nested
    @DisplayName("writeFile")
    class WriteFile {

        @Test
        @DisplayName("HEAD equals the returned hash and the record size equals the byte length")
        void headAndSize() {
            String content = "\\section{Résumé}\n";
            var result = fx.files.writeFile(mainId, "/chapters/one.tex", content, "Add chapter one", owner);

            assertTrue(result.changed());
            assertEquals("chapters/one.tex", result.path());
            assertEquals(fx.git.revParse(repo, "main"), result.commitHash());
            assertEquals(result.commitHash(), fx.store.findBranch(mainId).orElseThrow().headCommitHash());

            FileRecord record = fx.store.findFile(mainId, "chapters/one.tex").orElseThrow();
            assertEquals(content.getBytes(StandardCharsets.UTF_8).length, record.size());
            assertEquals(owner.id(), record.createdBy());
            assertEquals("Add chapter one", fx.git.run(repo, "log", "-1", "--format=%s"));
            assertEquals("Ada <ada@example.org>", fx.git.run(repo, "log", "-1", "--format=%an <%ae>"));
        }

        @Test
        @DisplayName("blank content is replaced by the placeholder")
        void placeholder() throws Exception {
            fx.files.writeFile(mainId, "empty.tex", "   ", null, owner);

            String expected = PathPolicy.placeholder("empty.tex");
            assertEquals(expected, Files.readString(repo.resolve("empty.tex")));
            assertEquals(expected.length(), fx.store.findFile(mainId, "empty.tex").orElseThrow().size());
            assertEquals("Update empty.tex", fx.git.run(repo, "log", "-1", "--format=%s"));
        }

        @Test
        @DisplayName("writing identical content makes no commit")
        void identicalContent() {
            var first = fx.files.writeFile(mainId, "a.tex", "same", null, owner);
            var second = fx.files.writeFile(mainId, "a.tex", "same", null, owner);

            assertFalse(second.changed());
            assertEquals(first.commitHash(), second.commitHash());
        }

        @Test
        @DisplayName("ignored file names are still committed")
        void ignoredPathIsForced() {
            var result = fx.files.writeFile(mainId, "notes.log", "kept on purpose", null, owner);

            assertTrue(result.changed());
            assertTrue(fx.git.exec(repo, "ls-files", "--error-unmatch", "--", "notes.log").success());
        }

        @Test
        @DisplayName("a file named like a later directory prefix is a path collision")
        void fileThenDirectory() {
            fx.files.writeFile(mainId, "docs", "plain", null, owner);

            var e = assertThrows(ConflictException.class,
                    () -> fx.files.writeFile(mainId, "docs/intro.tex", "x", null, owner));
            assertEquals(ConflictException.Reason.PATH_COLLISION, e.reason());
        }

        @Test
        @DisplayName("read-only users cannot write")
        void readerDenied() {
            Actor reader = EngineFixture.actor("Reader");
            fx.permissions.grant(mainId, reader.id(), PermissionFlags.READ_ONLY, owner.id());

            assertThrows(PermissionDeniedException.class,
                    () -> fx.files.writeFile(mainId, "a.tex", "x", null, reader));
        }

        @Test
        @DisplayName("unsafe paths never reach the working tree")
        void unsafePath() {
            assertThrows(ValidationException.class,
                    () -> fx.files.writeFile(mainId, "../escape.tex", "x", null, owner));
            assertFalse(Files.exists(root.resolve("escape.tex")));
        }
    }

    @Test
    @DisplayName("writes on a branch never move main")
    void branchIsolation() {
        String mainHead = fx.git.revParse(repo, "main");
        Branch draft = fx.branches.createBranch(projectId, "draft", null, null, owner);

        var result = fx.files.writeFile(draft.id(), "draft.tex", "draft only", null, owner);

        assertEquals(mainHead, fx.git.revParse(repo, "main"));
        assertEquals(mainHead, fx.store.findBranch(mainId).orElseThrow().headCommitHash());
        assertEquals(result.commitHash(), fx.git.revParse(repo, "draft"));
        assertThrows(NotFoundException.class, () -> fx.files.readFile(mainId, "draft.tex", owner));
    }

    @Test
    @DisplayName("names with quotes and tabs commit on their branch and stay off main")
    void specialCharacterNames() {
        Branch draft = fx.branches.createBranch(projectId, "draft", null, null, owner);

        var quoted = fx.files.writeFile(draft.id(), "say \"hi\".tex", "quoted", null, owner);
        var tabbed = fx.files.writeFile(draft.id(), "tab\there.tex", "tabbed", null, owner);
        assertTrue(quoted.changed());
        assertTrue(tabbed.changed());

        var onMain = fx.files.writeFile(mainId, "intro.tex", "Hello", null, owner);

        Set<String> mainTree = Set.of(fx.git.run(repo, "ls-tree", "-r", "-z", "--name-only", "main").split("\0"));
        assertTrue(mainTree.contains("intro.tex"));
        assertFalse(mainTree.contains("say \"hi\".tex"));
        assertFalse(mainTree.contains("tab\there.tex"));
        assertEquals(onMain.commitHash(), fx.git.revParse(repo, "main"));
        assertEquals("quoted", fx.files.readFile(draft.id(), "say \"hi\".tex", owner).content());
    }

    @Test
    @DisplayName("a write whose staging is exhausted leaves nothing in the index")
    void exhaustedStagingIsUnstaged() {
        var failing = new StagingProtocol(fx.git, fx.metrics, 1, 0) {
            @Override
            public int stage(Path repoPath, String relative) {
                fx.git.run(repoPath, "add", "--", relative);
                throw new ConflictException(ConflictException.Reason.STAGING_EXHAUSTED, "Failed to stage " + relative);
            }
        };
        var store = new FileStore(fx.store, fx.branches, fx.permissions, fx.git, failing, fx.lock, fx.metrics);
        Branch draft = fx.branches.createBranch(projectId, "draft", null, null, owner);

        var e = assertThrows(ConflictException.class,
                () -> store.writeFile(draft.id(), "leak.tex", "draft only", null, owner));
        assertEquals(ConflictException.Reason.STAGING_EXHAUSTED, e.reason());
        assertEquals("", fx.git.run(repo, "diff", "--cached", "--name-only"));

        fx.files.writeFile(mainId, "intro.tex", "Hello", null, owner);
        assertEquals("intro.tex", fx.git.run(repo, "show", "--name-only", "--format=", "main"));
    }

    @Nested
    @DisplayName("readFile")
    class ReadFile {

        @Test
        @DisplayName("falls back to the legacy file/ directory")
        void legacyFallback() throws Exception {
            Files.createDirectories(repo.resolve(RepositoryLayout.LEGACY_FILE_DIR));
            Files.writeString(repo.resolve(RepositoryLayout.LEGACY_FILE_DIR).resolve("old.tex"), "legacy");

            assertEquals("legacy", fx.files.readFile(mainId, "old.tex", owner).content());
        }

        @Test
        @DisplayName("missing files are NOT_FOUND")
        void missing() {
            assertThrows(NotFoundException.class, () -> fx.files.readFile(mainId, "nope.tex", owner));
        }
    }

    @Nested
    @DisplayName("listFiles")
    class ListFiles {

        @Test
        @DisplayName("includes tracked files without records and records of committed files")
        void unionOfGitAndIndex() {
            fx.files.writeFile(mainId, "chapters/one.tex", "one", null, owner);

            Set<String> paths = fx.files.listFiles(mainId, owner).stream()
                    .map(FileEntry::path).collect(Collectors.toSet());

            assertTrue(paths.containsAll(Set.of("README.md", ".gitignore", "chapters/one.tex")));
            for (FileRecord record : fx.store.listFiles(mainId)) {
                assertTrue(paths.contains(record.path()));
            }
        }

        @Test
        @DisplayName("marks tracked-but-unindexed files and repairs stale sizes")
        void flagsAndRepair() {
            fx.files.writeFile(mainId, "a.tex", "12345", null, owner);
            var record = fx.store.findFile(mainId, "a.tex").orElseThrow();
            fx.store.saveFile(record.withSize(1));

            var entries = fx.files.listFiles(mainId, owner);

            FileEntry readme = entries.stream().filter(e -> e.path().equals("README.md")).findFirst().orElseThrow();
            assertTrue(readme.tracked());
            assertFalse(readme.indexed());
            assertNull(readme.fileId());

            FileEntry a = entries.stream().filter(e -> e.path().equals("a.tex")).findFirst().orElseThrow();
            assertEquals(5, a.size());
            assertEquals(5, fx.store.findFile(mainId, "a.tex").orElseThrow().size());
        }
    }

    @Nested
    @DisplayName("deleteFile")
    class DeleteFile {

        @Test
        @DisplayName("removes the file in a commit and soft-deletes the record")
        void deletes() {
            fx.files.writeFile(mainId, "a.tex", "x", null, owner);

            var result = fx.files.deleteFile(mainId, "a.tex", null, owner);

            assertTrue(result.changed());
            assertEquals(fx.git.revParse(repo, "main"), result.commitHash());
            assertEquals("Delete a.tex", fx.git.run(repo, "log", "-1", "--format=%s"));
            assertFalse(Files.exists(repo.resolve("a.tex")));
            assertTrue(fx.store.findFile(mainId, "a.tex").orElseThrow().isDeleted());
            assertTrue(fx.store.listFiles(mainId).isEmpty());
        }

        @Test
        @DisplayName("unknown files are NOT_FOUND")
        void unknown() {
            assertThrows(NotFoundException.class, () -> fx.files.deleteFile(mainId, "ghost.tex", null, owner));
        }

        @Test
        @DisplayName("a directory path is rejected before git rm runs")
        void directory() {
            fx.files.writeFile(mainId, "docs/a.tex", "x", null, owner);
            String head = fx.git.revParse(repo, "main");

            assertThrows(ValidationException.class, () -> fx.files.deleteFile(mainId, "docs", null, owner));
            assertEquals(head, fx.git.revParse(repo, "main"));
            assertTrue(Files.exists(repo.resolve("docs/a.tex")));
        }

        @Test
        @DisplayName("a deleted file can be written again")
        void rewriteAfterDelete() {
            fx.files.writeFile(mainId, "a.tex", "x", null, owner);
            fx.files.deleteFile(mainId, "a.tex", null, owner);

            var again = fx.files.writeFile(mainId, "a.tex", "y", null, owner);

            assertTrue(again.changed());
            assertFalse(fx.store.findFile(mainId, "a.tex").orElseThrow().isDeleted());
        }
    }

    @Nested
    @DisplayName("createDirectory and deleteDirectory")
    class Directories {

        @Test
        @DisplayName("a staging failure part-way leaves no files staged or written")
        void failedCreateCleansUp() {
            var failing = new StagingProtocol(fx.git, fx.metrics, 1, 0) {
                @Override
                public int stage(Path repoPath, String relative) {
                    if (relative.endsWith("two.tex")) {
                        throw new ConflictException(ConflictException.Reason.STAGING_EXHAUSTED,
                                "Failed to stage " + relative);
                    }
                    return super.stage(repoPath, relative);
                }
            };
            var store = new FileStore(fx.store, fx.branches, fx.permissions, fx.git, failing, fx.lock, fx.metrics);
            String head = fx.git.revParse(repo, "main");

            assertThrows(ConflictException.class, () -> store.createDirectory(mainId, "paper",
                    Map.of("one.tex", "1", "two.tex", "2"), null, owner));

            assertEquals(head, fx.git.revParse(repo, "main"));
            assertEquals("", fx.git.run(repo, "diff", "--cached", "--name-only"));
            assertFalse(Files.exists(repo.resolve("paper/one.tex")));
            assertFalse(Files.exists(repo.resolve("paper/two.tex")));
        }

        @Test
        @DisplayName("deleteDirectory on a file path is a validation error")
        void deleteDirectoryOnFile() {
            fx.files.writeFile(mainId, "paper.tex", "x", null, owner);

            assertThrows(ValidationException.class, () -> fx.files.deleteDirectory(mainId, "paper.tex", null, owner));
        }

        @Test
        @DisplayName("an empty file map is a validation error")
        void emptyDirectory() {
            assertThrows(ValidationException.class,
                    () -> fx.files.createDirectory(mainId, "paper", Map.of(), null, owner));
        }
    }
}
