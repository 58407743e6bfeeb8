package com.codeops.workbench.exception;

/**
 * Thrown when an in-memory tree is found corrupted: a parent chain that never
 * reaches root, or a request index entry that disagrees with the tree.
 */
public class InvariantViolationException extends WorkbenchException {

    /**
     * Creates a new InvariantViolationException with the specified message.
     *
     * @param message the detail message
     */
    public InvariantViolationException(String message) {
        super(message);
    }
}
