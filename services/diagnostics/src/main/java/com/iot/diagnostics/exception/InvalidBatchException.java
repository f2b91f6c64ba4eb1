package com.iot.diagnostics.exception;

/**
 * The payload parsed but does not have the shape of a diagnostics batch.
 * Raised before any model runs.
 */
public class InvalidBatchException extends RuntimeException {

    public InvalidBatchException(String message) {
        super(message);
    }
}
