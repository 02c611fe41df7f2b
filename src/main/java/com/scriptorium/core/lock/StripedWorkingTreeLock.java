package com.scriptorium.core.lock;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes work per project inside one JVM using a fixed set of lock stripes.
 * Two projects may share a stripe; a project always maps to the same one.
 */
public class StripedWorkingTreeLock implements WorkingTreeLock {

    static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public StripedWorkingTreeLock() {
        this(DEFAULT_STRIPES);
    }

    public StripedWorkingTreeLock(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public <T> T withLock(UUID projectId, Supplier<T> work) {
        ReentrantLock lock = stripeFor(projectId);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(UUID projectId) {
        return stripes[Math.floorMod(projectId.hashCode(), stripes.length)];
    }
}
