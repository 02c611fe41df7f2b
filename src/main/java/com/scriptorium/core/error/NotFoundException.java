package com.scriptorium.core.error;

/**
 * A repository, branch, file or compilation job does not exist.
 */
public class NotFoundException extends ScriptoriumException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
