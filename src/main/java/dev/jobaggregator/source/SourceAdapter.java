package dev.jobaggregator.source;

import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.model.SourceConfig;
import dev.jobaggregator.ratelimit.RateLimiter;
import reactor.core.publisher.Flux;

/**
 * Interface for job-listing sites.
 * Each site implements this interface; adapters know nothing about filtering or other sites.
 */
public interface SourceAdapter {

    /**
     * Stable identifier used in configuration, queries and reports (e.g. "indeed").
     */
    String getSourceId();

    SourceConfig getConfig();

    /**
     * Fetch raw listings for a query, page by page.
     * <p>
     * The returned flux is cold: every subscription opens its own browser session and starts
     * from page 1. It terminates with {@code BlockedException}, {@code NetworkException},
     * {@code PageParseException} or {@code RateBudgetExhaustedException} on failure, after
     * emitting whatever earlier pages produced.
     *
     * @param limiter the calling run's rate-limiter session; every page load acquires from it
     */
    Flux<JobListing> fetchRaw(SearchQuery query, int maxPages, RateLimiter.Session limiter);

    default boolean isEnabled() {
        return getConfig().enabled();
    }

    default int getPriority() {
        return getConfig().priority();
    }
}
