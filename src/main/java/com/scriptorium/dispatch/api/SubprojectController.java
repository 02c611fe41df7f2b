package com.scriptorium.dispatch.api;

import com.scriptorium.core.engine.VersionControlEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
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
 * REST controller for LaTeX sub-projects, the compilable directories of a branch.
 */
@RestController
@RequestMapping("/api/v1/branches/{branchId}/subprojects")
public class SubprojectController {

    private final VersionControlEngine engine;

    public SubprojectController(VersionControlEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    public ResponseEntity<Object> list(@PathVariable UUID branchId,
                                       @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.listSubprojects(branchId, ActorHeaders.toActor(actorId, null, null)));
    }

    @GetMapping("/{name}")
    public ResponseEntity<Object> get(@PathVariable UUID branchId, @PathVariable String name,
                                      @RequestHeader(ActorHeaders.ID) UUID actorId) {
        return ApiResponses.of(engine.getSubproject(branchId, name, ActorHeaders.toActor(actorId, null, null)));
    }

    /**
     * POST /api/v1/branches/{branchId}/subprojects: Create a sub-project from a template in one commit.
     */
    @PostMapping
    public ResponseEntity<Object> create(@PathVariable UUID branchId,
                                         @RequestBody CreateSubprojectRequest request,
                                         @RequestHeader(ActorHeaders.ID) UUID actorId,
                                         @RequestHeader(value = ActorHeaders.NAME, required = false) String actorName,
                                         @RequestHeader(value = ActorHeaders.EMAIL, required = false) String actorEmail) {
        var result = engine.createSubproject(branchId, request.name(), request.template(), request.files(),
                request.commitMessage(), ActorHeaders.toActor(actorId, actorName, actorEmail));
        return ApiResponses.of(result, HttpStatus.CREATED);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Object> delete(@PathVariable UUID branchId, @PathVariable String name,
                                         @RequestParam(required = false) String message,
                                         @RequestHeader(ActorHeaders.ID) UUID actorId,
                                         @RequestHeader(value = ActorHeaders.NAME, required = false) String actorName,
                                         @RequestHeader(value = ActorHeaders.EMAIL, required = false) String actorEmail) {
        return ApiResponses.of(engine.deleteSubproject(branchId, name, message,
                ActorHeaders.toActor(actorId, actorName, actorEmail)));
    }
}
