package com.scriptorium.core.error;

/**
 * Fatal infrastructure failure: the Git binary cannot be started or the
 * index store is unreachable. Never converted into an operation result.
 */
public class InfrastructureException extends RuntimeException {

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
