package com.scriptorium.dispatch.cli;

import com.scriptorium.core.compile.CompilationJob;
import com.scriptorium.core.compile.CompilationStatus;
import com.scriptorium.core.compile.LatexEngine;
import com.scriptorium.core.compile.OutputFormat;
import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.engine.OperationResult;
import com.scriptorium.core.engine.VersionControlEngine;
import com.scriptorium.core.error.ConflictException;
import com.scriptorium.core.error.InfrastructureException;
import com.scriptorium.core.health.HealthCheckService;
import com.scriptorium.core.health.HealthStatus;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPage;
import com.scriptorium.core.model.BranchStatus;
import com.scriptorium.core.model.BranchSummary;
import com.scriptorium.core.model.FileContent;
import com.scriptorium.core.model.InitializationResult;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.subproject.Subproject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Exercises picocli directly without a Spring context: parsing, help output
 * and what each command prints for engine results.
 */
class CliTest {

    private static final UUID PROJECT = UUID.fromString("6f1c0c1e-0000-4000-8000-000000000001");
    private static final UUID BRANCH = UUID.fromString("6f1c0c1e-0000-4000-8000-000000000002");
    private static final UUID ACTOR = UUID.fromString("6f1c0c1e-0000-4000-8000-000000000003");
    private static final String JOB = "0f8fad5b-d9cb-469f-a165-70867728950e";

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory createFactory(VersionControlEngine engine, HealthCheckService health) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == InitCommand.class) {
                    return (K) new InitCommand(engine);
                }
                if (cls == BranchCommand.class) {
                    return (K) new BranchCommand(engine);
                }
                if (cls == WriteCommand.class) {
                    return (K) new WriteCommand(engine);
                }
                if (cls == ReadCommand.class) {
                    return (K) new ReadCommand(engine);
                }
                if (cls == FilesCommand.class) {
                    return (K) new FilesCommand(engine);
                }
                if (cls == SubprojectCommand.class) {
                    return (K) new SubprojectCommand(engine);
                }
                if (cls == CompileCommand.class) {
                    return (K) new CompileCommand(engine, new ScriptoriumProperties());
                }
                if (cls == JobCommand.class) {
                    return (K) new JobCommand(engine);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == ServeCommand.class) {
                    return (K) new ServeCommand();
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        return execute(mock(VersionControlEngine.class), null, args);
    }

    private CliResult execute(VersionControlEngine engine, String... args) {
        return execute(engine, null, args);
    }

    private CliResult execute(VersionControlEngine engine, HealthCheckService health, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CliRunner(new ScriptoriumCommand(), createFactory(engine, health))
                    .commandLine();
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static CompilationJob job(CompilationStatus status) {
        var started = CompilationJob.started(JOB, PROJECT, BRANCH, "paper", "main.tex", OutputFormat.PDF,
                LatexEngine.PDFLATEX, ACTOR, Instant.now());
        return switch (status) {
            case STARTED -> started;
            case RUNNING -> started.running(Instant.now());
            case COMPLETED -> started.running(Instant.now()).completed(Instant.now(),
                    List.of("LaTeX Warning: Reference `fig:1' undefined"), List.of());
            case FAILED, TIMEOUT -> started.finished(status, Instant.now(), List.of("! Emergency stop."));
        };
    }

    @Nested
    @DisplayName("help")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String name : List.of("init", "branch", "write", "read", "files", "subproject", "compile", "job",
                    "health", "serve")) {
                assertTrue(result.output().contains(name), "missing " + name);
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Scriptorium 0.1.0"));
        }

        @Test
        @DisplayName("compile --help shows engine and format options")
        void compileHelp() {
            CliResult result = execute("compile", "--help");

            assertTrue(result.output().contains("--engine"));
            assertTrue(result.output().contains("--format"));
            assertTrue(result.output().contains("--wait"));
        }
    }

    @Nested
    @DisplayName("execution")
    class ExecutionTests {

        @Test
        @DisplayName("init reports a new repository")
        void init() {
            var engine = mock(VersionControlEngine.class);
            UUID main = UUID.randomUUID();
            when(engine.initialize(eq(PROJECT), eq("Thesis"), any(Actor.class)))
                    .thenReturn(OperationResult.ok(new InitializationResult("/repos/thesis_6f1c0c1e", main, true)));

            CliResult result = execute(engine, "init", PROJECT.toString(), "Thesis", "--actor", ACTOR.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Repository initialized at /repos/thesis_6f1c0c1e"));
            assertTrue(result.output().contains("Main branch: " + main));
        }

        @Test
        @DisplayName("--actor is required")
        void actorRequired() {
            var engine = mock(VersionControlEngine.class);

            CliResult result = execute(engine, "init", PROJECT.toString(), "Thesis");

            assertNotEquals(0, result.exitCode());
            assertTrue(result.output().contains("--actor"));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("branch lists rows with their permissions")
        void listBranches() {
            var engine = mock(VersionControlEngine.class);
            Instant now = Instant.now();
            var main = new Branch(BRANCH, PROJECT, "main", null, null, "abcdef1234", BranchStatus.ACTIVE,
                    true, true, ACTOR, now, now);
            var page = BranchPage.of(List.of(new BranchSummary(main, 2, new PermissionFlags(true, false, false))),
                    1, 1, 20);
            when(engine.listBranches(eq(PROJECT), eq(1), eq(20), any(Actor.class))).thenReturn(OperationResult.ok(page));

            CliResult result = execute(engine, "branch", PROJECT.toString(), "--actor", ACTOR.toString());

            assertTrue(result.output().contains("main *"));
            assertTrue(result.output().contains("abcdef1"));
            assertTrue(result.output().contains("r--"));
            assertTrue(result.output().contains("1 branch(es) total"));
        }

        @Test
        @DisplayName("write prints the error kind on conflict")
        void writeConflict() {
            var engine = mock(VersionControlEngine.class);
            when(engine.writeFile(eq(BRANCH), eq("docs"), eq("x"), isNull(), any(Actor.class)))
                    .thenReturn(OperationResult.failure(new ConflictException(
                            ConflictException.Reason.PATH_COLLISION, "docs is a directory")));

            CliResult result = execute(engine, "write", BRANCH.toString(), "docs", "--content", "x",
                    "--actor", ACTOR.toString());

            assertTrue(result.output().contains("CONFLICT: docs is a directory"));
        }

        @Test
        @DisplayName("read prints the file content")
        void read() {
            var engine = mock(VersionControlEngine.class);
            when(engine.readFile(eq(BRANCH), eq("main.tex"), any(Actor.class)))
                    .thenReturn(OperationResult.ok(new FileContent("main.tex", "\\documentclass{article}", 23,
                            Instant.now())));

            CliResult result = execute(engine, "read", BRANCH.toString(), "main.tex", "--actor", ACTOR.toString());

            assertTrue(result.output().contains("\\documentclass{article}"));
        }

        @Test
        @DisplayName("subproject lists each sub-project with its entry point")
        void subprojectList() {
            var engine = mock(VersionControlEngine.class);
            when(engine.listSubprojects(eq(BRANCH), any(Actor.class))).thenReturn(OperationResult.ok(List.of(
                    new Subproject("paper", "paper", "main.tex", 2, Instant.now(), List.of()),
                    new Subproject("old", "file/old", "thesis.tex", 1, Instant.now(), List.of()))));

            CliResult result = execute(engine, "subproject", BRANCH.toString(), "--actor", ACTOR.toString());

            assertTrue(result.output().contains("paper/main.tex"));
            assertTrue(result.output().contains("file/old/thesis.tex"));
            assertTrue(result.output().contains("2 sub-project(s)"));
        }

        @Test
        @DisplayName("subproject --create sends local files laid over the template")
        void subprojectCreate(@TempDir Path dir) throws Exception {
            Path chapter = Files.writeString(dir.resolve("one.tex"), "\\chapter{One}");
            var engine = mock(VersionControlEngine.class);
            when(engine.createSubproject(eq(BRANCH), eq("paper"), eq("report"),
                    eq(Map.of("chapters/one.tex", "\\chapter{One}")), isNull(), any(Actor.class)))
                    .thenReturn(OperationResult.ok(new Subproject("paper", "paper", "main.tex", 3, Instant.now(),
                            List.of())));

            CliResult result = execute(engine, "subproject", BRANCH.toString(), "--create", "paper",
                    "--template", "report", "--file", "chapters/one.tex=" + chapter, "--actor", ACTOR.toString());

            assertTrue(result.output().contains("Created LaTeX project paper"), result.output());
            assertTrue(result.output().contains("Main file: main.tex"));
        }

        @Test
        @DisplayName("subproject --create and --delete are mutually exclusive")
        void subprojectExclusive() {
            var engine = mock(VersionControlEngine.class);

            CliResult result = execute(engine, "subproject", BRANCH.toString(), "--create", "a", "--delete", "b",
                    "--actor", ACTOR.toString());

            assertTrue(result.output().contains("Use only one of --create, --show and --delete"));
            verifyNoInteractions(engine);
        }

        @Test
        @DisplayName("compile without --wait only submits")
        void compileNoWait() {
            var engine = mock(VersionControlEngine.class);
            when(engine.submitCompilation(eq(BRANCH), eq("paper"), eq("main.tex"), eq("xelatex"), eq("pdf"),
                    any(Actor.class))).thenReturn(OperationResult.ok(job(CompilationStatus.STARTED)));

            CliResult result = execute(engine, "compile", BRANCH.toString(), "paper", "--engine", "xelatex",
                    "--actor", ACTOR.toString());

            assertTrue(result.output().contains("Compilation " + JOB + " started"));
            verify(engine, never()).getCompilationStatus(any(), any());
        }

        @Test
        @DisplayName("compile --wait polls until the job is terminal")
        void compileWait() {
            var engine = mock(VersionControlEngine.class);
            when(engine.submitCompilation(eq(BRANCH), eq("paper"), eq("main.tex"), eq("pdflatex"), eq("pdf"),
                    any(Actor.class))).thenReturn(OperationResult.ok(job(CompilationStatus.STARTED)));
            when(engine.getCompilationStatus(eq(JOB), any(Actor.class)))
                    .thenReturn(OperationResult.ok(job(CompilationStatus.COMPLETED)));

            CliResult result = execute(engine, "compile", BRANCH.toString(), "paper", "--wait",
                    "--actor", ACTOR.toString());

            assertTrue(result.output().contains("Status: completed"));
            assertTrue(result.output().contains("Reference `fig:1' undefined"));
        }

        @Test
        @DisplayName("compile --wait with a zero timeout marks the job timed out")
        void compileTimeout() {
            var engine = mock(VersionControlEngine.class);
            when(engine.submitCompilation(eq(BRANCH), eq("paper"), eq("main.tex"), eq("pdflatex"), eq("pdf"),
                    any(Actor.class))).thenReturn(OperationResult.ok(job(CompilationStatus.RUNNING)));
            when(engine.markCompilationTimeout(JOB)).thenReturn(OperationResult.ok(job(CompilationStatus.TIMEOUT)));

            CliResult result = execute(engine, "compile", BRANCH.toString(), "paper", "--wait", "--timeout", "0",
                    "--actor", ACTOR.toString());

            assertTrue(result.output().contains("Status: timeout"));
            verify(engine).markCompilationTimeout(JOB);
        }

        @Test
        @DisplayName("job --mark-failed records the reason")
        void markFailed() {
            var engine = mock(VersionControlEngine.class);
            when(engine.markCompilationFailed(JOB, "cancelled"))
                    .thenReturn(OperationResult.ok(job(CompilationStatus.FAILED)));

            CliResult result = execute(engine, "job", JOB, "--mark-failed", "cancelled", "--actor", ACTOR.toString());

            assertTrue(result.output().contains("Status: failed"));
            verify(engine, never()).getCompilationStatus(any(), any());
        }

        @Test
        @DisplayName("health shows each component and the overall state")
        void health() {
            var health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("git", HealthStatus.Status.UP, "git version 2.43.0", Map.of()),
                    new HealthStatus("database", HealthStatus.Status.DEGRADED, "index is in memory", Map.of())));

            CliResult result = execute(mock(VersionControlEngine.class), health, "health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("git: git version 2.43.0"));
            assertTrue(result.output().contains("database: index is in memory"));
            assertTrue(result.output().contains("Overall: DEGRADED (database)"));
        }

        @Test
        @DisplayName("health exits 1 and names the components that are down")
        void healthDown() {
            var health = mock(HealthCheckService.class);
            when(health.checkAll()).thenReturn(List.of(
                    new HealthStatus("git", HealthStatus.Status.DOWN, "Git executable 'git' not available", Map.of()),
                    new HealthStatus("database", HealthStatus.Status.DEGRADED, "index is in memory", Map.of()),
                    new HealthStatus("storage", HealthStatus.Status.UP, "Storage root writable", Map.of())));

            CliResult result = execute(mock(VersionControlEngine.class), health, "health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Overall: DOWN (git)"));
        }

        @Test
        @DisplayName("an unreachable index is reported on one line with exit code 2")
        void infrastructureFailure() {
            var engine = mock(VersionControlEngine.class);
            when(engine.readFile(eq(BRANCH), eq("main.tex"), any(Actor.class)))
                    .thenThrow(new InfrastructureException("Index unavailable", new IllegalStateException("connection refused")));

            CliResult result = execute(engine, "read", BRANCH.toString(), "main.tex", "--actor", ACTOR.toString());

            assertEquals(CliRunner.INFRASTRUCTURE_FAILURE, result.exitCode());
            assertTrue(result.output().contains("read failed: Index unavailable"));
        }

        @Test
        @DisplayName("health without a service reports it unavailable")
        void healthUnavailable() {
            CliResult result = execute("health");

            assertTrue(result.output().contains("Health check service not available"));
            assertEquals(1, result.exitCode());
        }
    }

    @Nested
    @DisplayName("serve detection")
    class ServeDetection {

        @Test
        @DisplayName("serve as the subcommand starts the server")
        void serve() {
            assertTrue(CliRunner.isServeInvocation(List.of("serve")));
            assertTrue(CliRunner.isServeInvocation(List.of("--verbose", "serve")));
        }

        @Test
        @DisplayName("a file named serve and serve --help stay in CLI mode")
        void notServe() {
            assertFalse(CliRunner.isServeInvocation(List.of("write", BRANCH.toString(), "serve", "--actor", "x")));
            assertFalse(CliRunner.isServeInvocation(List.of("serve", "--help")));
            assertFalse(CliRunner.isServeInvocation(List.of()));
        }
    }
}
