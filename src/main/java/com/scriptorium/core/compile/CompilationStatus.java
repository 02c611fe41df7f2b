package com.scriptorium.core.compile;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a compilation job. Terminal states never change.
 */
public enum CompilationStatus {
    STARTED,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT;
    }

    public boolean canTransitionTo(CompilationStatus next) {
        return allowedNext().contains(next);
    }

    private Set<CompilationStatus> allowedNext() {
        return switch (this) {
            case STARTED -> EnumSet.of(RUNNING, FAILED, TIMEOUT);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, TIMEOUT);
            case COMPLETED, FAILED, TIMEOUT -> EnumSet.noneOf(CompilationStatus.class);
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CompilationStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
