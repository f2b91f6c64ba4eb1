package com.iot.diagnostics.exception;

/**
 * The payload is not valid JSON.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
