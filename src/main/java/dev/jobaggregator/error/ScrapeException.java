package dev.jobaggregator.error;

import lombok.Getter;

/**
 * Base class for failures local to one source. These never abort a run; the orchestrator
 * records them in the source's outcome.
 */
@Getter
public abstract class ScrapeException extends RuntimeException {

    private final String sourceId;

    protected ScrapeException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    protected ScrapeException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }
}
