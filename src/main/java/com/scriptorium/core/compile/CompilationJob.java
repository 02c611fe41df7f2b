package com.scriptorium.core.compile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The status document persisted as {@code metadata.json} in the job directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompilationJob(
    String jobId,
    UUID projectId,
    UUID branchId,
    String subprojectId,
    String mainFile,
    OutputFormat outputFormat,
    LatexEngine engine,
    UUID compiledBy,
    CompilationStatus status,
    Instant startedAt,
    Instant updatedAt,
    Instant completedAt,
    List<String> errors,
    List<String> warnings,
    List<OutputFile> outputFiles
) {
    public CompilationJob {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        outputFiles = outputFiles == null ? List.of() : List.copyOf(outputFiles);
    }

    public static CompilationJob started(String jobId, UUID projectId, UUID branchId, String subprojectId,
                                         String mainFile, OutputFormat format, LatexEngine engine,
                                         UUID compiledBy, Instant at) {
        return new CompilationJob(jobId, projectId, branchId, subprojectId, mainFile, format, engine, compiledBy,
                CompilationStatus.STARTED, at, at, null, List.of(), List.of(), List.of());
    }

    public CompilationJob running(Instant at) {
        return new CompilationJob(jobId, projectId, branchId, subprojectId, mainFile, outputFormat, engine,
                compiledBy, CompilationStatus.RUNNING, startedAt, at, null, errors, warnings, outputFiles);
    }

    public CompilationJob completed(Instant at, List<String> newWarnings, List<OutputFile> files) {
        return new CompilationJob(jobId, projectId, branchId, subprojectId, mainFile, outputFormat, engine,
                compiledBy, CompilationStatus.COMPLETED, startedAt, at, at, errors, newWarnings, files);
    }

    /**
     * Terminal failure or timeout, appending the given error lines.
     */
    public CompilationJob finished(CompilationStatus terminal, Instant at, List<String> newErrors) {
        List<String> allErrors = new ArrayList<>(errors);
        allErrors.addAll(newErrors);
        return new CompilationJob(jobId, projectId, branchId, subprojectId, mainFile, outputFormat, engine,
                compiledBy, terminal, startedAt, at, at, allErrors, warnings, outputFiles);
    }

    public CompilationJob withOutputFiles(List<OutputFile> files) {
        return new CompilationJob(jobId, projectId, branchId, subprojectId, mainFile, outputFormat, engine,
                compiledBy, status, startedAt, updatedAt, completedAt, errors, warnings, files);
    }
}
