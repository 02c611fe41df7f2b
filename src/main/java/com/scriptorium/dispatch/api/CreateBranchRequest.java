package com.scriptorium.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/projects/{projectId}/branches.
 *
 * @param sourceBranch branch to fork from; nullable, defaults to main
 */
public record CreateBranchRequest(
    String name,
    @JsonProperty("source_branch") String sourceBranch,
    String description
) {}
