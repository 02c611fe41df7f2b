package com.scriptorium.core.compile;

import com.scriptorium.core.branch.BranchManager;
import com.scriptorium.core.config.ScriptoriumProperties;
import com.scriptorium.core.error.ExternalToolException;
import com.scriptorium.core.error.NotFoundException;
import com.scriptorium.core.error.ValidationException;
import com.scriptorium.core.lock.WorkingTreeLock;
import com.scriptorium.core.logging.MdcContext;
import com.scriptorium.core.metrics.ScriptoriumMetrics;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.permission.PermissionIndex;
import com.scriptorium.core.repository.RepositoryLayout;
import com.scriptorium.core.subproject.SubprojectNames;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fire-and-forget LaTeX compilation of a branch's sub-project.
 *
 * <p>Each job copies the sources into {@code compilations/<jobId>/source},
 * runs the engine on a worker thread and records progress in the job's
 * {@code metadata.json}. Timeouts are driven by the caller through
 * {@link #markTimeout(String)}.
 */
@Service
public class CompilationScheduler {

    private static final Logger log = LoggerFactory.getLogger(CompilationScheduler.class);

    static final String DEFAULT_MAIN_FILE = "main.tex";
    static final String SOURCE_DIR = "source";
    static final String OUTPUT_DIR = "output";
    static final String TRANSCRIPT_FILE = "compiler-output.txt";
    private static final int TRANSCRIPT_LIMIT = 4000;

    private final BranchManager branches;
    private final PermissionIndex permissions;
    private final WorkingTreeLock lock;
    private final CompilationStatusStore statusStore;
    private final ProcessLauncher launcher;
    private final ScriptoriumProperties properties;
    private final ScriptoriumMetrics metrics;
    private final ExecutorService workers;
    private final Map<String, Process> runningProcesses = new ConcurrentHashMap<>();

    @Autowired
    public CompilationScheduler(BranchManager branches, PermissionIndex permissions, WorkingTreeLock lock,
                                CompilationStatusStore statusStore, ProcessLauncher launcher,
                                ScriptoriumProperties properties, ScriptoriumMetrics metrics) {
        this(branches, permissions, lock, statusStore, launcher, properties, metrics,
                newWorkerPool(properties.getCompilationPoolSize()));
    }

    CompilationScheduler(BranchManager branches, PermissionIndex permissions, WorkingTreeLock lock,
                         CompilationStatusStore statusStore, ProcessLauncher launcher,
                         ScriptoriumProperties properties, ScriptoriumMetrics metrics, ExecutorService workers) {
        this.branches = branches;
        this.permissions = permissions;
        this.lock = lock;
        this.statusStore = statusStore;
        this.launcher = launcher;
        this.properties = properties;
        this.metrics = metrics;
        this.workers = workers;
    }

    /**
     * Snapshots the sub-project sources and queues a compilation.
     *
     * @param subprojectId directory of the LaTeX sub-project, a single path segment
     * @param mainFile     entry point, defaults to {@code main.tex}; falls back to the
     *                     first {@code *.tex} file when missing
     * @return the status document in state {@code started}
     */
    public CompilationJob submit(UUID branchId, String subprojectId, String mainFile, String engineName,
                                 String formatName, Actor actor) {
        LatexEngine engine = LatexEngine.parse(engineName);
        OutputFormat format = OutputFormat.parse(formatName);
        SubprojectNames.validate(subprojectId);
        String requestedMain = validateMainFile(mainFile);

        Branch branch = branches.requireBranch(branchId);
        permissions.requireRead(branch, actor);

        String jobId = UUID.randomUUID().toString();
        MdcContext.setBranch(branch.projectId(), branch.id());
        MdcContext.setJob(jobId);
        try {
            CompilationJob job = lock.withLock(branch.projectId(), () -> {
                Path repoPath = branches.checkout(branch);
                Path sourceDir = SourceLocation.resolve(repoPath, subprojectId)
                        .orElseThrow(() -> new NotFoundException(
                                "LaTeX project directory not found: " + subprojectId));
                String resolvedMain = resolveMainFile(sourceDir, requestedMain);

                Path jobDir = repoPath.resolve(RepositoryLayout.COMPILATIONS_DIR).resolve(jobId);
                try {
                    Files.createDirectories(jobDir.resolve(OUTPUT_DIR));
                    copyTree(sourceDir, jobDir.resolve(SOURCE_DIR));
                } catch (IOException e) {
                    throw new ExternalToolException("Failed to prepare compilation workspace " + jobDir, e);
                }

                var started = CompilationJob.started(jobId, branch.projectId(), branch.id(), subprojectId,
                        resolvedMain, format, engine, actor.id(), Instant.now());
                statusStore.create(jobDir, started);
                return started;
            });

            try {
                workers.execute(() -> runJob(jobId));
            } catch (RejectedExecutionException e) {
                log.error("Compilation worker pool rejected job {}", jobId, e);
                markFailed(jobId, "Compilation could not be scheduled");
            }
            log.info("Started {} compilation {} of '{}' ({}) on branch '{}'",
                    engine.command(), jobId, subprojectId, job.mainFile(), branch.name());
            return job;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * The status document with a live listing of the output directory.
     */
    public CompilationJob getStatus(String jobId, Actor actor) {
        CompilationJob job = statusStore.read(jobId);
        requireReadAccess(job, actor);
        return job.withOutputFiles(scanOutputs(statusStore.locate(jobId)));
    }

    /**
     * The first artifact with the requested extension, default the job's format.
     * Only completed jobs have artifacts.
     */
    public CompilationArtifact getOutputFile(String jobId, String formatName, Actor actor) {
        CompilationJob job = statusStore.read(jobId);
        requireReadAccess(job, actor);
        if (job.status() != CompilationStatus.COMPLETED) {
            throw new NotFoundException("Compilation " + jobId + " is " + job.status().value() + ", not completed");
        }
        OutputFormat format = formatName == null || formatName.isBlank() ? job.outputFormat() : OutputFormat.parse(formatName);
        Path outputDir = statusStore.locate(jobId).resolve(OUTPUT_DIR);
        Path artifact = listFiles(outputDir).stream()
                .filter(p -> p.getFileName().toString().endsWith("." + format.extension()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException(
                        "No ." + format.extension() + " file found for compilation " + jobId));
        String filename = job.subprojectId() + "_" + jobId.substring(0, 8) + "." + format.extension();
        return new CompilationArtifact(jobId, artifact, filename, sizeOf(artifact), format);
    }

    /**
     * Moves a non-terminal job to {@code timeout} and kills its process tree.
     *
     * @return the job's document after the call; unchanged when it was already terminal
     */
    public CompilationJob markTimeout(String jobId) {
        Optional<CompilationJob> updated = statusStore.transition(jobId, CompilationStatus.TIMEOUT,
                job -> job.finished(CompilationStatus.TIMEOUT, Instant.now(), List.of("Compilation timed out")));
        updated.ifPresent(job -> {
            destroyProcess(jobId);
            metrics.recordCompilationResult(CompilationStatus.TIMEOUT.value());
            log.warn("Compilation {} timed out", jobId);
        });
        return updated.orElseGet(() -> statusStore.read(jobId));
    }

    /**
     * Moves a non-terminal job to {@code failed} with the given reason.
     */
    public CompilationJob markFailed(String jobId, String reason) {
        String message = reason == null || reason.isBlank() ? "Compilation failed" : reason;
        Optional<CompilationJob> updated = statusStore.transition(jobId, CompilationStatus.FAILED,
                job -> job.finished(CompilationStatus.FAILED, Instant.now(), List.of(message)));
        updated.ifPresent(job -> {
            destroyProcess(jobId);
            metrics.recordCompilationResult(CompilationStatus.FAILED.value());
            log.error("Compilation {} marked failed: {}", jobId, message);
        });
        return updated.orElseGet(() -> statusStore.read(jobId));
    }

    @PreDestroy
    void shutdown() {
        workers.shutdown();
        runningProcesses.keySet().forEach(this::destroyProcess);
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Compilation workers stopped");
    }

    // -- Worker --

    void runJob(String jobId) {
        MdcContext.setJob(jobId);
        long start = System.currentTimeMillis();
        try {
            Optional<CompilationJob> running = statusStore.transition(jobId, CompilationStatus.RUNNING,
                    job -> job.running(Instant.now()));
            if (running.isEmpty()) {
                log.info("Compilation {} no longer pending; skipping", jobId);
                return;
            }
            CompilationJob job = running.get();
            Path jobDir = statusStore.locate(jobId);
            Path outputDir = jobDir.resolve(OUTPUT_DIR);
            Path transcript = jobDir.resolve(TRANSCRIPT_FILE);

            List<String> command = List.of(
                    properties.engineCommand(job.engine().command()),
                    "-interaction=nonstopmode",
                    "-output-directory=" + outputDir.toAbsolutePath(),
                    job.mainFile());
            log.debug("Running {} in {}", command, jobDir.resolve(SOURCE_DIR));

            Process process = launcher.launch(command, jobDir.resolve(SOURCE_DIR), transcript);
            int exitCode = awaitExit(jobId, process);

            Path texLog = outputDir.resolve(baseName(job.mainFile()) + ".log");
            if (exitCode == 0) {
                List<String> warnings = LatexLogParser.warnings(texLog);
                List<OutputFile> outputs = scanOutputs(jobDir);
                statusStore.transition(jobId, CompilationStatus.COMPLETED,
                        j -> j.completed(Instant.now(), warnings, outputs))
                        .ifPresent(j -> {
                            metrics.recordCompilationResult(CompilationStatus.COMPLETED.value());
                            log.info("Compilation {} completed with {} warning(s)", jobId, warnings.size());
                        });
            } else {
                List<String> errors = new ArrayList<>();
                String output = readTranscript(transcript);
                errors.add(output.isBlank() ? "Compiler exited with code " + exitCode : output);
                errors.addAll(LatexLogParser.errors(texLog));
                statusStore.transition(jobId, CompilationStatus.FAILED,
                        j -> j.finished(CompilationStatus.FAILED, Instant.now(), errors))
                        .ifPresent(j -> {
                            metrics.recordCompilationResult(CompilationStatus.FAILED.value());
                            log.error("Compilation {} failed with exit code {}", jobId, exitCode);
                        });
            }
            metrics.recordCompilationDuration(job.engine().command(), System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyProcess(jobId);
            markFailed(jobId, "Compilation interrupted");
        } catch (IOException | RuntimeException e) {
            log.error("Compilation {} failed with exception", jobId, e);
            markFailed(jobId, String.valueOf(e.getMessage()));
        } finally {
            MdcContext.clear();
        }
    }

    private int awaitExit(String jobId, Process process) throws InterruptedException {
        runningProcesses.put(jobId, process);
        try {
            // a timeout may have landed between the RUNNING transition and launch
            if (statusStore.read(jobId).status().isTerminal()) {
                destroyProcess(jobId);
            }
            return process.waitFor();
        } finally {
            runningProcesses.remove(jobId);
        }
    }

    // -- Helpers --

    private void requireReadAccess(CompilationJob job, Actor actor) {
        if (job.branchId() != null) {
            permissions.requireRead(branches.requireBranch(job.branchId()), actor);
        }
    }

    private void destroyProcess(String jobId) {
        Process process = runningProcesses.remove(jobId);
        if (process != null && process.isAlive()) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            log.info("Destroyed compiler process {} of job {}", process.pid(), jobId);
        }
    }

    private static String validateMainFile(String mainFile) {
        if (mainFile == null || mainFile.isBlank()) {
            return DEFAULT_MAIN_FILE;
        }
        String normalized = mainFile.strip().replace('\\', '/');
        if (normalized.startsWith("/")) {
            throw new ValidationException("Main file must be relative: " + mainFile);
        }
        for (String segment : normalized.split("/")) {
            if (segment.equals("..")) {
                throw new ValidationException("Main file must not contain '..': " + mainFile);
            }
        }
        return normalized;
    }

    /**
     * The requested main file, or the first {@code *.tex} in name order.
     */
    static String resolveMainFile(Path sourceDir, String requested) {
        if (Files.isRegularFile(sourceDir.resolve(requested))) {
            return requested;
        }
        Optional<Path> fallback = listFiles(sourceDir).stream()
                .filter(p -> p.getFileName().toString().endsWith(".tex"))
                .findFirst();
        if (fallback.isEmpty()) {
            throw new ValidationException(
                    "Main file not found and no .tex files present in project: " + requested);
        }
        String name = fallback.get().getFileName().toString();
        log.warn("Requested main file '{}' not found. Falling back to '{}'", requested, name);
        return name;
    }

    private static List<OutputFile> scanOutputs(Path jobDir) {
        List<OutputFile> outputs = new ArrayList<>();
        for (Path file : listFiles(jobDir.resolve(OUTPUT_DIR))) {
            outputs.add(new OutputFile(file.getFileName().toString(), sizeOf(file),
                    jobDir.relativize(file).toString().replace('\\', '/')));
        }
        return outputs;
    }

    /** Regular files directly inside {@code dir}, sorted by name. */
    private static List<Path> listFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, Files::isRegularFile)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new ExternalToolException("Cannot list " + dir, e);
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    private static void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.copy(file, target.resolve(source.relativize(file).toString()));
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static String readTranscript(Path transcript) {
        if (!Files.isRegularFile(transcript)) {
            return "";
        }
        try {
            String text = new String(Files.readAllBytes(transcript), StandardCharsets.UTF_8).strip();
            return text.length() > TRANSCRIPT_LIMIT ? text.substring(text.length() - TRANSCRIPT_LIMIT) : text;
        } catch (IOException e) {
            log.warn("Cannot read compiler transcript {}: {}", transcript, e.getMessage());
            return "";
        }
    }

    private static String baseName(String mainFile) {
        String name = mainFile.substring(mainFile.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private static ExecutorService newWorkerPool(int poolSize) {
        int size = Math.max(1, poolSize);
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), r -> {
            Thread t = new Thread(r, "latex-compiler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
