package com.scriptorium.dispatch.api;

import com.scriptorium.core.compile.CompilationArtifact;
import com.scriptorium.core.engine.VersionControlEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for LaTeX compilations.
 */
@RestController
@RequestMapping("/api/v1")
public class CompilationController {

    private static final Logger log = LoggerFactory.getLogger(CompilationController.class);

    private final VersionControlEngine engine;
    private final CompilationWatchdog watchdog;

    public CompilationController(VersionControlEngine engine, CompilationWatchdog watchdog) {
        this.engine = engine;
        this.watchdog = watchdog;
    }

    /**
     * POST /api/v1/branches/{branchId}/compilations: Start a compilation. Returns 202
     * with the initial status document; poll the job for progress.
     */
    @PostMapping("/branches/{branchId}/compilations")
    public ResponseEntity<Object> submit(@PathVariable UUID branchId, @RequestBody CompileRequest request,
                                         @RequestHeader(ActorHeaders.ID) UUID actorId) {
        if (request.subprojectId() == null || request.subprojectId().isBlank()) {
            return ApiResponses.badRequest("subproject_id is required");
        }
        var result = engine.submitCompilation(branchId, request.subprojectId(), request.mainFile(),
                request.engine(), request.outputFormat(), ActorHeaders.toActor(actorId, null, null));
        if (result.isSuccess()) {
            watchdog.watch(result.value().jobId());
            log.info("Accepted compilation {} on branch {}", result.value().jobId(), branchId);
        }
        return ApiResponses.of(result, HttpStatus.ACCEPTED);
    }

    @GetMapping("/compilations/{jobId}")
    public ResponseEntity<Object> status(@PathVariable String jobId,
                                         @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.getCompilationStatus(jobId, ActorHeaders.toActor(actorId, null, null)));
    }

    /**
     * GET /api/v1/compilations/{jobId}/artifact?format=: Download the compiled document.
     */
    @GetMapping("/compilations/{jobId}/artifact")
    public ResponseEntity<Object> artifact(@PathVariable String jobId,
                                           @RequestParam(required = false) String format,
                                           @RequestHeader(ActorHeaders.ID) UUID actorId) {
        var result = engine.getCompilationOutput(jobId, format, ActorHeaders.toActor(actorId, null, null));
        if (!result.isSuccess()) {
            return ApiResponses.error(result);
        }
        CompilationArtifact artifact = result.value();
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.contentType()))
                .contentLength(artifact.size())
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.filename()).build().toString())
                .body(new FileSystemResource(artifact.file()));
    }

    /**
     * POST /api/v1/compilations/{jobId}/timeout: Mark a running job timed out.
     */
    @PostMapping("/compilations/{jobId}/timeout")
    public ResponseEntity<Object> timeout(@PathVariable String jobId) {
        return ApiResponses.of(engine.markCompilationTimeout(jobId));
    }
}
