package com.codeops.workbench.exception;

/**
 * Thrown when persisted collection data cannot be read, parsed, migrated or written.
 */
public class StorageException extends WorkbenchException {

    /**
     * Creates a new StorageException with the specified message.
     *
     * @param message the detail message
     */
    public StorageException(String message) {
        super(message);
    }

    /**
     * Creates a new StorageException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the underlying I/O or serialization failure
     */
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
