package com.loandesk.dto;

import java.time.LocalDateTime;

/**
 * Error body returned by every failed request.
 *
 * @param timestamp when the error was produced
 * @param status    HTTP status code
 * @param error     short title of the error class
 * @param message   specific failure message
 * @param path      request URI
 */
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path
) {
    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path);
    }
}
