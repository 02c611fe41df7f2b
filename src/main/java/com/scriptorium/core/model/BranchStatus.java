package com.scriptorium.core.model;

import java.util.Locale;

/**
 * Lifecycle status of an indexed branch.
 */
public enum BranchStatus {
    ACTIVE,
    MERGED,
    ARCHIVED,
    DELETED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BranchStatus fromDbValue(String value) {
        if (value == null) {
            return ACTIVE;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
