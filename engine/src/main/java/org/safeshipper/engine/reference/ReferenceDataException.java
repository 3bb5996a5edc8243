package org.safeshipper.engine.reference;

/**
 * Reference data could not be loaded or is inconsistent.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
