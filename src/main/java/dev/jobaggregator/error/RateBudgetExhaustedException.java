package dev.jobaggregator.error;

public class RateBudgetExhaustedException extends ScrapeException {

    public RateBudgetExhaustedException(String sourceId, int maxRequests) {
        super(sourceId, "Request budget of " + maxRequests + " exhausted for " + sourceId);
    }
}
