package com.iot.diagnostics.exception;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body shared by the HTTP and command-line adapters: {@code {"error": "..."}}.
 */
public record ErrorResponse(
    @JsonProperty("error")
    String error
) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse(message);
    }

    /**
     * Error body for an unexpected failure. Falls back to the exception type
     * when there is no message.
     */
    public static ErrorResponse of(Throwable ex) {
        String message = ex.getMessage();
        return new ErrorResponse(message != null ? message : ex.getClass().getSimpleName());
    }
}
