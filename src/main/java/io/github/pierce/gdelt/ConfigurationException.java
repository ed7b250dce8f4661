package io.github.pierce.gdelt;

/**
 * Thrown when a key-column specification does not fit the join case it is declared for.
 */
public class ConfigurationException extends GdeltProcessingException {

    public ConfigurationException(String message) {
        super(message);
    }
}
