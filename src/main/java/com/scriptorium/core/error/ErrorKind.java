package com.scriptorium.core.error;

/**
 * Classification of expected engine failures.
 */
public enum ErrorKind {
    NOT_FOUND,
    PERMISSION_DENIED,
    CONFLICT,
    EXTERNAL_TOOL_FAILURE,
    VALIDATION_ERROR,
    INCONSISTENT_STATE
}
