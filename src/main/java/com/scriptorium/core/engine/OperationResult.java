package com.scriptorium.core.engine;

import com.scriptorium.core.error.ConflictException;
import com.scriptorium.core.error.ErrorKind;
import com.scriptorium.core.error.ScriptoriumException;

import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or an error kind with a message.
 *
 * @param conflictReason set only for {@link ErrorKind#CONFLICT}
 */
public record OperationResult<T>(
    T value,
    ErrorKind errorKind,
    String message,
    ConflictException.Reason conflictReason
) {
    public static <T> OperationResult<T> ok(T value) {
        return new OperationResult<>(value, null, null, null);
    }

    public static <T> OperationResult<T> failure(ErrorKind kind, String message) {
        return new OperationResult<>(null, kind, message, null);
    }

    public static <T> OperationResult<T> failure(ScriptoriumException e) {
        ConflictException.Reason reason = e instanceof ConflictException conflict ? conflict.reason() : null;
        return new OperationResult<>(null, e.kind(), e.getMessage(), reason);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public <R> OperationResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return new OperationResult<>(null, errorKind, message, conflictReason);
        }
        return ok(mapper.apply(value));
    }
}
