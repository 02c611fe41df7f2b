package com.scriptorium.core.model;

/**
 * A branch row merged with its live file count and the caller's effective permissions.
 */
public record BranchSummary(Branch branch, int fileCount, PermissionFlags permissions) {}
