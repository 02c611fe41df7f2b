package com.scriptorium.dispatch.api;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for branch file operations. Paths are passed as the
 * {@code path} query parameter since they may contain slashes.
 */
@RestController
@RequestMapping("/api/v1/branches/{branchId}/files")
public class FileController {

    private final VersionControlEngine engine;

    public FileController(VersionControlEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public ResponseEntity<Object> list(@PathVariable UUID branchId,
                                       @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.listFiles(branchId, ActorHeaders.toActor(actorId, null, null)));
    }

    @GetMapping("/content")
    public ResponseEntity<Object> read(@PathVariable UUID branchId, @RequestParam String path,
                                       @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.readFile(branchId, path, ActorHeaders.toActor(actorId, null, null)));
    }

    /**
     * PUT /api/v1/branches/{branchId}/files?path=: Write and commit one file.
     */
    @PutMapping
    public ResponseEntity<Object> write(@PathVariable UUID branchId, @RequestParam String path,
                                        @RequestBody WriteFileRequest request,
                                        @RequestHeader(ActorHeaders.ID) UUID actorId,
                                        @RequestHeader(value = ActorHeaders.NAME, required = false) String actorName,
                                        @RequestHeader(value = ActorHeaders.EMAIL, required = false) String actorEmail) {
        return ApiResponses.of(engine.writeFile(branchId, path, request.content(), request.commitMessage(),
                ActorHeaders.toActor(actorId, actorName, actorEmail)));
    }

    @DeleteMapping
    public ResponseEntity<Object> delete(@PathVariable UUID branchId, @RequestParam String path,
                                         @RequestParam(required = false) String message,
                                         @RequestHeader(ActorHeaders.ID) UUID actorId,
                                         @RequestHeader(value = ActorHeaders.NAME, required = false) String actorName,
                                         @RequestHeader(value = ActorHeaders.EMAIL, required = false) String actorEmail) {
        return ApiResponses.of(engine.deleteFile(branchId, path, message,
                ActorHeaders.toActor(actorId, actorName, actorEmail)));
    }
}
