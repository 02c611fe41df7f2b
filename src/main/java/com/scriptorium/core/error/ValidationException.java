package com.scriptorium.core.error;

/**
 * Malformed input: empty paths, bad identifiers, unsupported engines or formats.
 */
public class ValidationException extends ScriptoriumException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_ERROR;
    }
}
