package com.scriptorium.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/projects/{projectId}/repository.
 *
 * @param projectName display name used for the working directory and README
 */
public record InitializeRequest(
    @JsonProperty("project_name") String projectName
) {}
