package com.scriptorium.core.engine;

import com.scriptorium.core.branch.BranchManager;
import com.scriptorium.core.compile.CompilationArtifact;
import com.scriptorium.core.compile.CompilationJob;
import com.scriptorium.core.compile.CompilationScheduler;
import com.scriptorium.core.error.ScriptoriumException;
import com.scriptorium.core.files.FileStore;
import com.scriptorium.core.model.Actor;
import com.scriptorium.core.model.Branch;
import com.scriptorium.core.model.BranchPage;
import com.scriptorium.core.model.CommitResult;
import com.scriptorium.core.model.FileContent;
import com.scriptorium.core.model.FileEntry;
import com.scriptorium.core.model.InitializationResult;
import com.scriptorium.core.model.PermissionFlags;
import com.scriptorium.core.permission.PermissionIndex;
import com.scriptorium.core.repository.RepositoryManager;
import com.scriptorium.core.subproject.Subproject;
import com.scriptorium.core.subproject.SubprojectService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point used by the REST and CLI layers.
 * <p>
 * Expected failures (missing rows, denied access, conflicts, failing Git or
 * LaTeX commands, bad input) come back as failed {@link OperationResult}s.
 * Infrastructure failures propagate as exceptions.
 */
@Service
public class VersionControlEngine {

    private static final Logger log = LoggerFactory.getLogger(VersionControlEngine.class);

    private final RepositoryManager repositories;
    private final BranchManager branches;
    private final FileStore files;
    private final PermissionIndex permissions;
    private final CompilationScheduler compilations;
    private final SubprojectService subprojects;

    public VersionControlEngine(RepositoryManager repositories, BranchManager branches, FileStore files,
                                PermissionIndex permissions, CompilationScheduler compilations,
                                SubprojectService subprojects) {
        this.repositories = repositories;
        this.branches = branches;
        this.files = files;
        this.permissions = permissions;
        this.compilations = compilations;
        this.subprojects = subprojects;
    }

    public OperationResult<InitializationResult> initialize(UUID projectId, String projectName, Actor actor) {
        return execute("initialize", () -> repositories.initialize(projectId, projectName, actor));
    }

    public OperationResult<Branch> createBranch(UUID projectId, String name, String sourceBranch,
                                                String description, Actor actor) {
        return execute("createBranch", () -> branches.createBranch(projectId, name, sourceBranch, description, actor));
    }

    public OperationResult<BranchPage> listBranches(UUID projectId, int page, int size, Actor actor) {
        return execute("listBranches", () -> branches.listBranches(projectId, page, size, actor));
    }

    public OperationResult<PermissionFlags> getBranchPermission(UUID branchId, UUID userId, Actor actor) {
        return execute("getBranchPermission", () -> permissions.getBranchPermission(branchId, userId, actor));
    }

    public OperationResult<PermissionFlags> updateBranchPermission(UUID branchId, UUID userId,
                                                                   PermissionFlags flags, Actor actor) {
        return execute("updateBranchPermission",
                () -> permissions.updateBranchPermission(branchId, userId, flags, actor));
    }

    public OperationResult<CommitResult> writeFile(UUID branchId, String path, String content, String message,
                                                   Actor actor) {
        return execute("writeFile", () -> files.writeFile(branchId, path, content, message, actor));
    }

    public OperationResult<FileContent> readFile(UUID branchId, String path, Actor actor) {
        return execute("readFile", () -> files.readFile(branchId, path, actor));
    }

    public OperationResult<List<FileEntry>> listFiles(UUID branchId, Actor actor) {
        return execute("listFiles", () -> files.listFiles(branchId, actor));
    }

    public OperationResult<CommitResult> deleteFile(UUID branchId, String path, String message, Actor actor) {
        return execute("deleteFile", () -> files.deleteFile(branchId, path, message, actor));
    }

    public OperationResult<List<Subproject>> listSubprojects(UUID branchId, Actor actor) {
        return execute("listSubprojects", () -> subprojects.listSubprojects(branchId, actor));
    }

    public OperationResult<Subproject> getSubproject(UUID branchId, String name, Actor actor) {
        return execute("getSubproject", () -> subprojects.getSubproject(branchId, name, actor));
    }

    public OperationResult<Subproject> createSubproject(UUID branchId, String name, String template,
                                                        Map<String, String> files, String message, Actor actor) {
        return execute("createSubproject",
                () -> subprojects.createSubproject(branchId, name, template, files, message, actor));
    }

    public OperationResult<CommitResult> deleteSubproject(UUID branchId, String name, String message, Actor actor) {
        return execute("deleteSubproject", () -> subprojects.deleteSubproject(branchId, name, message, actor));
    }

    public OperationResult<CompilationJob> submitCompilation(UUID branchId, String subprojectId, String mainFile,
                                                             String engine, String outputFormat, Actor actor) {
        return execute("submitCompilation",
                () -> compilations.submit(branchId, subprojectId, mainFile, engine, outputFormat, actor));
    }

    public OperationResult<CompilationJob> getCompilationStatus(String jobId, Actor actor) {
        return execute("getCompilationStatus", () -> compilations.getStatus(jobId, actor));
    }

    public OperationResult<CompilationArtifact> getCompilationOutput(String jobId, String format, Actor actor) {
        return execute("getCompilationOutput", () -> compilations.getOutputFile(jobId, format, actor));
    }

    public OperationResult<CompilationJob> markCompilationTimeout(String jobId) {
        return execute("markCompilationTimeout", () -> compilations.markTimeout(jobId));
    }

    public OperationResult<CompilationJob> markCompilationFailed(String jobId, String reason) {
        return execute("markCompilationFailed", () -> compilations.markFailed(jobId, reason));
    }

    private <T> OperationResult<T> execute(String operation, Supplier<T> work) {
        try {
            return OperationResult.ok(work.get());
        } catch (ScriptoriumException e) {
            log.debug("{} failed with {}: {}", operation, e.kind(), e.getMessage());
            return OperationResult.failure(e);
        }
    }
}
