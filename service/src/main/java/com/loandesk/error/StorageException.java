package com.loandesk.error;

/**
 * Thrown when the storage backend fails to store, read or delete a file.
 */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
