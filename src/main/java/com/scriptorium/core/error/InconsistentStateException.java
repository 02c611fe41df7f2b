package com.scriptorium.core.error;

/**
 * The index and the filesystem disagree in a way self-healing could not repair.
 */
public class InconsistentStateException extends ScriptoriumException {

    public InconsistentStateException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INCONSISTENT_STATE;
    }
}
