package com.scriptorium.dispatch.api;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for per-branch user permissions.
 */
@RestController
@RequestMapping("/api/v1/branches/{branchId}/permissions/{userId}")
public class PermissionController {

    private final VersionControlEngine engine;

    public PermissionController(VersionControlEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public ResponseEntity<Object> get(@PathVariable UUID branchId, @PathVariable UUID userId,
                                      @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.getBranchPermission(branchId, userId,
                ActorHeaders.toActor(actorId, null, null)));
    }

    /**
     * PUT /api/v1/branches/{branchId}/permissions/{userId}: Requires admin on the branch.
     */
    @PutMapping
    public ResponseEntity<Object> update(@PathVariable UUID branchId, @PathVariable UUID userId,
                                         @RequestBody PermissionRequest request,
                                         @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.updateBranchPermission(branchId, userId, request.toFlags(),
                ActorHeaders.toActor(actorId, null, null)));
    }
}
