package com.codeops.workbench.exception;

/**
 * Thrown when an operation is called with arguments it must reject, such as
 * renaming the root folder, moving a folder into its own subtree or a blank name.
 */
public class ValidationException extends WorkbenchException {

    /**
     * Creates a new ValidationException with the specified message.
     *
     * @param message the detail message
     */
    public ValidationException(String message) {
        super(message);
    }
}
