package com.travelbooking.backend.global.error;

/**
 * Persistence failed underneath a domain operation. Not a user error: the handler
 * reports it as a generic storage outage and logs the cause for alerting.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
