package com.nosota.scavenger.dto;

import java.time.LocalDateTime;

/**
 * Error body returned by {@link com.nosota.scavenger.exception.GlobalExceptionHandler}.
 *
 * @param timestamp When the error was produced
 * @param status    HTTP status code
 * @param error     Short title
 * @param code      Machine-readable error code (NOT_FOUND, UNAUTHORIZED, ...)
 * @param message   Human-readable detail
 * @param path      Request URI
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String code,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String error, String code, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, code, message, path);
    }
}
