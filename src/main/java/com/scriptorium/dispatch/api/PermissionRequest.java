package com.scriptorium.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scriptorium.core.model.PermissionFlags;

/**
 * Inbound JSON body for PUT /api/v1/branches/{branchId}/permissions/{userId}.
 * Missing flags are treated as false.
 */
public record PermissionRequest(
    @JsonProperty("can_read") Boolean canRead,
    @JsonProperty("can_write") Boolean canWrite,
    @JsonProperty("can_admin") Boolean canAdmin
) {
    PermissionFlags toFlags() {
        return new PermissionFlags(Boolean.TRUE.equals(canRead), Boolean.TRUE.equals(canWrite),
                Boolean.TRUE.equals(canAdmin));
    }
}
