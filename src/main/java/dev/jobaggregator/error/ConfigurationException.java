package dev.jobaggregator.error;

/**
 * Invalid configuration or query. Fatal: raised before any source is contacted.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
