package com.example.techpack.interfaces.api.error;

import java.time.Instant;

/**
 * API-layer DTO used to serialize error payloads.
 *
 * @param timestamp moment the error was mapped
 * @param status    HTTP status code
 * @param error     stable error code such as {@code DOMAIN_ERROR}
 * @param message   human readable explanation
 * @param path      request path that produced the error
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(Instant.now(), status, error, message, path);
    }
}
