package com.scriptorium.core.error;

/**
 * Base type for expected engine failures. The engine facade converts these
 * into failed operation results instead of letting them escape.
 */
public abstract class ScriptoriumException extends RuntimeException {

    protected ScriptoriumException(String message) {
        super(message);
    }

    protected ScriptoriumException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
