package com.kvtrack.cache.common.exception;

import com.kvtrack.cache.common.Result;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

public final class Http {

    public static final String NOT_FOUND = "ERR-NOT-FOUND";

    private Http() {
    }

    public static <T> ResponseEntity<?> from(Result<T> r) {
        if (r == null) return ResponseEntity.internalServerError().body("Result is null");

        if (r.isSuccess()) {
            return ResponseEntity.ok(r.getData());
        }
        return ResponseEntity.status(statusOf(r.getErrorCode()))
                .body(new ErrorResponse(r.getErrorCode(), r.getError(), r.getTimestamp()));
    }

    static HttpStatus statusOf(String errorCode) {
        if (errorCode == null) return HttpStatus.BAD_REQUEST;
        return switch (errorCode) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case BackendUnavailableException.DEFAULT_ERROR_CODE -> HttpStatus.SERVICE_UNAVAILABLE;
            case ConversionException.DEFAULT_ERROR_CODE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UpstreamFetchException.DEFAULT_ERROR_CODE -> HttpStatus.BAD_GATEWAY;
            case ValidationException.DEFAULT_ERROR_CODE -> HttpStatus.BAD_REQUEST;
            case "ERR-SYS-001" -> HttpStatus.INTERNAL_SERVER_ERROR;
            default -> HttpStatus.BAD_REQUEST;
        };
    }

    /**
     * Simple error response structure that will be returned to clients
     */
    private record ErrorResponse(String code, String message, java.time.Instant timestamp) {
    }
}
