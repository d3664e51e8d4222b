package dev.jobaggregator.error;

/**
 * Result cards were found but none could be extracted; the page structure changed.
 */
public class PageParseException extends ScrapeException {

    public PageParseException(String sourceId, String message) {
        super(sourceId, message);
    }
}
