package com.id.wattlog.errors;

/**
 * Malformed request input: an ingest payload or a query parameter. Mapped to 400.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }
}
