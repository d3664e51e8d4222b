package dev.jobaggregator.error;

/**
 * Navigation failed at the transport level or the server answered 5xx.
 */
public class NetworkException extends ScrapeException {

    public NetworkException(String sourceId, String message) {
        super(sourceId, message);
    }

    public NetworkException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }
}
