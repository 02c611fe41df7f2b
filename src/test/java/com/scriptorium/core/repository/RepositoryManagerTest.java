package com.scriptorium.core.repository;

import com.scriptorium.core.EngineFixture;
import com.scriptorium.core.error.InconsistentStateException;
import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.persistence.InMemoryIndexStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class RepositoryManagerTest {

    @TempDir
    Path root;

    private EngineFixture fx;
    private final UUID projectId = UUID.randomUUID();
    private final Actor owner = EngineFixture.actor("Ada");

    @BeforeEach
    void setUp() {
        assumeTrue(EngineFixture.gitAvailable(), "git not installed");
        fx = new EngineFixture(root);
    }

    @Test
    @DisplayName("initialize creates a repository on main with the initial commit")
    void initializeCreates() throws Exception {
        var result = fx.repositories.initialize(projectId, "My Thesis!", owner);

        assertTrue(result.created());
        Path repo = Path.of(result.repoPath());
        assertEquals(root.resolve("my_thesis__" + projectId.toString().substring(0, 8)), repo);
        assertTrue(Files.isRegularFile(repo.resolve(".gitignore")));
        assertTrue(Files.readString(repo.resolve(".gitignore")).contains("compilations/"));
        assertTrue(Files.isRegularFile(repo.resolve("README.md")));

        assertEquals("main", fx.git.run(repo, "rev-parse", "--abbrev-ref", "HEAD"));
        assertEquals(RepositoryLayout.INITIAL_COMMIT_MESSAGE, fx.git.run(repo, "log", "-1", "--format=%s"));
        assertEquals("Scriptorium System", fx.git.run(repo, "log", "-1", "--format=%an"));

        String head = fx.git.revParse(repo, "HEAD");
        var main = fx.store.findBranch(result.mainBranchId()).orElseThrow();
        assertEquals(head, main.headCommitHash());
        assertTrue(main.isDefault());
        assertEquals(head, fx.store.findRepository(projectId).orElseThrow().lastCommitHash());
    }

    @Test
    @DisplayName("the initializing actor gets full access on main")
    void ownerHasFullAccess() {
        var result = fx.repositories.initialize(projectId, "Thesis", owner);
        assertEquals(PermissionFlags.FULL, fx.permissions.get(result.mainBranchId(), owner.id()));
    }

    @Test
    @DisplayName("initialize is idempotent")
    void initializeTwice() throws Exception {
        var first = fx.repositories.initialize(projectId, "Thesis", owner);
        String head = fx.git.revParse(Path.of(first.repoPath()), "HEAD");

        var second = fx.repositories.initialize(projectId, "Thesis", owner);

        assertFalse(second.created());
        assertEquals(first.repoPath(), second.repoPath());
        assertEquals(first.mainBranchId(), second.mainBranchId());
        assertEquals(head, fx.git.revParse(Path.of(second.repoPath()), "HEAD"));
        assertEquals(1, fx.store.countBranches(projectId));
    }

    @Test
    @DisplayName("a blank project name is rejected")
    void blankName() {
        assertThrows(ValidationException.class, () -> fx.repositories.initialize(projectId, "  ", owner));
    }

    @Test
    @DisplayName("requireRepository fails for unknown projects")
    void unknownProject() {
        assertThrows(NotFoundException.class, () -> fx.repositories.requireRepository(UUID.randomUUID()));
    }

    @Nested
    @DisplayName("recovery")
    class Recovery {

        @Test
        @DisplayName("a missing working directory is rebuilt on next use")
        void selfHeal() throws Exception {
            var result = fx.repositories.initialize(projectId, "Thesis", owner);
            Path repo = Path.of(result.repoPath());
            deleteTree(repo);

            var healed = fx.repositories.ensureWorkingTree(fx.repositories.requireRepository(projectId));

            assertTrue(RepositoryLayout.isWorkingTree(repo));
            String head = fx.git.revParse(repo, "HEAD");
            assertEquals(head, healed.lastCommitHash());
            assertEquals(head, fx.store.findBranch(result.mainBranchId()).orElseThrow().headCommitHash());
            assertEquals(1.0, fx.registry.find("scriptorium.repository.self_heal").counter().count());
        }

        @Test
        @DisplayName("an existing repository without index rows is re-indexed")
        void adoptOrphanRepository() {
            var first = fx.repositories.initialize(projectId, "Thesis", owner);
            var fresh = new EngineFixture(root, new InMemoryIndexStore());

            var adopted = fresh.repositories.initialize(projectId, "Thesis", owner);

            assertFalse(adopted.created());
            assertEquals(first.repoPath(), adopted.repoPath());
            assertTrue(fresh.store.findRepository(projectId).isPresent());
            assertEquals(PermissionFlags.FULL, fresh.permissions.get(adopted.mainBranchId(), owner.id()));
        }

        @Test
        @DisplayName("a non-Git directory in the way is an inconsistent state")
        void foreignDirectory() throws Exception {
            Files.createDirectories(RepositoryLayout.directoryFor(root, projectId, "Thesis").resolve("stuff"));

            assertThrows(InconsistentStateException.class,
                    () -> fx.repositories.initialize(projectId, "Thesis", owner));
            assertTrue(fx.store.findRepository(projectId).isEmpty());
        }
    }

    private static void deleteTree(Path path) throws Exception {
        try (Stream<Path> walk = Files.walk(path)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                p.toFile().setWritable(true);
                Files.delete(p);
            }
        }
    }
}
