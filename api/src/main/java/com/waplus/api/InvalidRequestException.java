package com.waplus.api;

/**
 * Raised for requests the engine refuses to run: bad time windows, unknown reduction methods,
 * unsupported granularities, bad paging. Mapped to HTTP 400.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
