package io.github.pierce.gdelt;

/**
 * Thrown for malformed or misaligned timestamps, invalid enumerated options and
 * missing statistics configuration.
 */
public class ValidationException extends GdeltProcessingException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
