package com.scriptorium.dispatch.api;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.http.HttpStatus;
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
 * REST controller for branch creation and listing.
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/branches")
public class BranchController {

    private final VersionControlEngine engine;

    public BranchController(VersionControlEngine engine) {
        this.engine = engine;
    }

    /**
     * GET /api/v1/projects/{projectId}/branches?page=&size=: Paginated branch list.
     */
    @GetMapping
    public ResponseEntity<Object> list(@PathVariable UUID projectId,
                                       @RequestParam(defaultValue = "1") int page,
                                       @RequestParam(defaultValue = "20") int size,
                                       @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.listBranches(projectId, page, size,
                ActorHeaders.toActor(actorId, null, null)));
    }

    /**
     * POST /api/v1/projects/{projectId}/branches: Fork a branch; the creator gets full access.
     */
    @PostMapping
    public ResponseEntity<Object> create(@PathVariable UUID projectId,
                                         @RequestBody CreateBranchRequest request,
                                         @RequestHeader(ActorHeaders.ID) UUID actorId,
                                         @RequestHeader(value = ActorHeaders.NAME, required = false) String actorName,
                                         @RequestHeader(value = ActorHeaders.EMAIL, required = false) String actorEmail) {
        var result = engine.createBranch(projectId, request.name(), request.sourceBranch(), request.description(),
                ActorHeaders.toActor(actorId, actorName, actorEmail));
        return ApiResponses.of(result, HttpStatus.CREATED);
    }
}
