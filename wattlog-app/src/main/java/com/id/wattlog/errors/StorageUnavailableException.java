package com.id.wattlog.errors;

/**
 * The measurement store could not be reached or rejected the operation.
 * Retrying is left to the caller.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
