package io.github.pierce.gdelt;

/**
 * Base exception for all errors raised while processing a GDELT file set.
 */
public class GdeltProcessingException extends RuntimeException {

    private final String timestamp;

    public GdeltProcessingException(String message) {
        super(message);
        this.timestamp = null;
    }

    public GdeltProcessingException(String message, Throwable cause) {
        super(message, cause);
        this.timestamp = null;
    }

    public GdeltProcessingException(String timestamp, String message, Throwable cause) {
        super(message, cause);
        this.timestamp = timestamp;
    }

    /**
     * Returns the processing instant the error belongs to, or null when it is not tied to one.
     */
    public String getTimestamp() {
        return timestamp;
    }

    @Override
    public String getMessage() {
        if (timestamp != null && !timestamp.isEmpty()) {
            return "Timestamp '" + timestamp + "': " + super.getMessage();
        }
        return super.getMessage();
    }
}
