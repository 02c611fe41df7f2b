package com.scriptorium.core.error;

/**
 * The request conflicts with existing state.
 */
public class ConflictException extends ScriptoriumException {

    public enum Reason {
        DUPLICATE_BRANCH,
        PATH_COLLISION,
        STAGING_EXHAUSTED
    }

    private final Reason reason;

    public ConflictException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONFLICT;
    }
}
