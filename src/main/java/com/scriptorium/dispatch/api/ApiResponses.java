package com.scriptorium.dispatch.api;

import com.scriptorium.core.engine.OperationResult;
import com.scriptorium.core.error.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine results onto HTTP responses.
 */
final class ApiResponses {

    private ApiResponses() {
    }

    static ResponseEntity<Object> of(OperationResult<?> result) {
        return of(result, HttpStatus.OK);
    }

    static ResponseEntity<Object> of(OperationResult<?> result, HttpStatus success) {
        if (result.isSuccess()) {
            return ResponseEntity.status(success).body(result.value());
        }
        return error(result);
    }

    static ResponseEntity<Object> error(OperationResult<?> result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", result.errorKind().name());
        body.put("message", result.message());
        if (result.conflictReason() != null) {
            body.put("reason", result.conflictReason().name());
        }
        return ResponseEntity.status(statusFor(result.errorKind())).body(body);
    }

    static ResponseEntity<Object> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", ErrorKind.VALIDATION_ERROR.name(),
                "message", message));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case EXTERNAL_TOOL_FAILURE -> HttpStatus.BAD_GATEWAY;
            case INCONSISTENT_STATE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
