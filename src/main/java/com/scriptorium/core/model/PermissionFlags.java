package com.scriptorium.core.model;

/**
 * Raw permission flags stored for a (branch, user) pair.
 * Effective checks treat admin as implying write, and write as implying read.
 */
public record PermissionFlags(boolean canRead, boolean canWrite, boolean canAdmin) {

    public static final PermissionFlags NONE = new PermissionFlags(false, false, false);
    public static final PermissionFlags FULL = new PermissionFlags(true, true, true);
    public static final PermissionFlags READ_ONLY = new PermissionFlags(true, false, false);

    public boolean allowsRead() {
        return canRead || canWrite || canAdmin;
    }

    public boolean allowsWrite() {
        return canWrite || canAdmin;
    }

    public boolean allowsAdmin() {
        return canAdmin;
    }

    /** Flags with the implications applied, as reported to callers. */
    public PermissionFlags effective() {
        return new PermissionFlags(allowsRead(), allowsWrite(), allowsAdmin());
    }
}
