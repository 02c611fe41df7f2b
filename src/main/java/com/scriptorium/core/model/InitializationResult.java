package com.scriptorium.core.model;

import java.util.UUID;

/**
 * Outcome of repository initialization.
 *
 * @param repoPath     working directory path
 * @param mainBranchId id of the "main" branch row
 * @param created      false when an existing repository was returned
 */
public record InitializationResult(String repoPath, UUID mainBranchId, boolean created) {}
