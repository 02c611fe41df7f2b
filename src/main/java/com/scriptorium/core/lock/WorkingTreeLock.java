package com.scriptorium.core.lock;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Mutual exclusion over a project's Git working tree.
 *
 * <p>Every branch of a project shares one working directory, so mutating
 * operations that check out a branch and commit must not interleave.
 */
public interface WorkingTreeLock {

    <T> T withLock(UUID projectId, Supplier<T> work);
}
