package com.screenir.compiler.exception;

/**
 * Raised when a raw design tree violates a structural requirement, such as a node
 * without an id.
 */
public class InvalidDesignTreeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidDesignTreeException(String message) {
        super(message);
    }
}
