package com.ai.tarot.exception;

/**
 * The session store backend could not be reached or returned an unreadable record.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
