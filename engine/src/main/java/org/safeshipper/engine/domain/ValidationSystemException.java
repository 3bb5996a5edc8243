package org.safeshipper.engine.domain;

/**
 * A validation could not reach a verdict. Never to be read as "incompatible".
 */
public class ValidationSystemException extends RuntimeException {

    public ValidationSystemException(String message) {
        super(message);
    }

    public ValidationSystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
