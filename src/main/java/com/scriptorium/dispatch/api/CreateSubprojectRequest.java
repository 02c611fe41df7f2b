package com.scriptorium.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/branches/{branchId}/subprojects.
 *
 * @param template article (default), report, book or beamer
 * @param files    nullable; contents keyed by path inside the sub-project, laid over the template
 */
public record CreateSubprojectRequest(
    String name,
    String template,
    Map<String, String> files,
    @JsonProperty("commit_message") String commitMessage
) {}
