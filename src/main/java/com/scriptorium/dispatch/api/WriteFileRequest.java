package com.scriptorium.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for PUT /api/v1/branches/{branchId}/files.
 *
 * @param content       UTF-8 text; blank content is replaced by a placeholder
 * @param commitMessage nullable, defaults to "Update &lt;path&gt;"
 */
public record WriteFileRequest(
    String content,
    @JsonProperty("commit_message") String commitMessage
) {}
