package com.scriptorium.dispatch.api;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for project repository setup.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/repository")
public class RepositoryController {

    private final VersionControlEngine engine;

    public RepositoryController(VersionControlEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/v1/projects/{projectId}/repository: Initialize (idempotent).
     * Returns 201 when a repository was created, 200 when it already existed.
     */
    @PostMapping
    public ResponseEntity<Object> initialize(@PathVariable UUID projectId,
                                             @RequestBody InitializeRequest request,
                                             @RequestHeader(ActorHeaders.ID) UUID actorId,
                                             @RequestHeader(value = ActorHeaders.NAME, required = false) String actorName,
                                             @RequestHeader(value = ActorHeaders.EMAIL, required = false) String actorEmail) {
        var result = engine.initialize(projectId, request.projectName(),
                ActorHeaders.toActor(actorId, actorName, actorEmail));
        if (!result.isSuccess()) {
            return ApiResponses.error(result);
        }
        return ApiResponses.of(result, result.value().created() ? HttpStatus.CREATED : HttpStatus.OK);
    }
}
