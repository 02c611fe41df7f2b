package com.scriptorium.core.model;

import java.time.Instant;
import java.util.UUID;

public record BranchPermission(
    UUID branchId,
    UUID userId,
    PermissionFlags flags,
    UUID grantedBy,
    Instant grantedAt
) {}
