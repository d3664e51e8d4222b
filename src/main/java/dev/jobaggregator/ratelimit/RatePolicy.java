package dev.jobaggregator.ratelimit;

import dev.jobaggregator.model.SourceConfig;

import java.time.Duration;

/**
 * Pacing rules for one source: a delay drawn from [minDelay, maxDelay] between consecutive
 * requests and a hard cap on requests per session.
 */
public record RatePolicy(Duration minDelay, Duration maxDelay, int maxRequests) {

    public RatePolicy {
        if (minDelay == null || maxDelay == null || minDelay.isNegative() || minDelay.compareTo(maxDelay) > 0) {
            throw new IllegalArgumentException("Invalid delay bounds: " + minDelay + " .. " + maxDelay);
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
    }

    public static RatePolicy of(SourceConfig config) {
        return new RatePolicy(config.minDelay(), config.maxDelay(), config.maxRequests());
    }
}
