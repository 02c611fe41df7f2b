package com.scriptorium.core.error;

/**
 * The actor lacks the branch permission an operation requires.
 */
public class PermissionDeniedException extends ScriptoriumException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PERMISSION_DENIED;
    }
}
