package com.codeops.workbench.exception;

/**
 * Thrown when a collection, folder, request or environment id does not resolve.
 */
public class NotFoundException extends WorkbenchException {

    /**
     * Creates a new NotFoundException with the specified message.
     *
     * @param message the detail message
     */
    public NotFoundException(String message) {
        super(message);
    }
}
