package com.screenir.compiler.exception;

/**
 * Raised when a design document or theme file cannot be read or has an unexpected shape.
 */
public class DesignDocumentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public DesignDocumentException(String message) {
        super(message);
    }

    public DesignDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
