package com.scriptorium.core.model;

/**
 * Result of a file mutation.
 *
 * @param path       normalized repository-relative path
 * @param commitHash branch head after the operation
 * @param changed    false when the content matched HEAD and no commit was made
 */
public record CommitResult(String path, String commitHash, boolean changed) {}
