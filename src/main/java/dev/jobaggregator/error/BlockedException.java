package dev.jobaggregator.error;

/**
 * The site served a denial, challenge or anomalous empty page. Never retried.
 */
public class BlockedException extends ScrapeException {

    public BlockedException(String sourceId, String message) {
        super(sourceId, message);
    }
}
