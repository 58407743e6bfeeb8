package com.codeops.workbench.exception;

/**
 * Base exception for all CodeOps-Workbench store exceptions.
 */
public class WorkbenchException extends RuntimeException {

    /**
     * Creates a new WorkbenchException with the specified message.
     *
     * @param message the detail message
     */
    public WorkbenchException(String message) {
        super(message);
    }

    /**
     * Creates a new WorkbenchException with the specified message and cause.
     *
     * @param message the detail message
     * @param cause   the root cause
     */
    public WorkbenchException(String message, Throwable cause) {
        super(message, cause);
    }
}
