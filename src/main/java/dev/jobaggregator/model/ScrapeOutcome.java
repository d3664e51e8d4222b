package dev.jobaggregator.model;

import java.time.Duration;
import java.util.List;

/**
 * What one source produced during a run.
 *
 * @param sourceId      source identifier
 * @param priority      source priority, lower is preferred
 * @param query         effective query text the source was asked for
 * @param listings      listings that passed the quality filter, in discovery order
 * @param rawCount      listings seen before filtering
 * @param filteredCount listings rejected by the quality filter
 * @param status        terminal status
 * @param errorDetail   reason for a non-OK status, otherwise {@code null}
 * @param elapsed       time spent on this source
 */
public record ScrapeOutcome(
        String sourceId,
        int priority,
        String query,
        List<JobListing> listings,
        int rawCount,
        int filteredCount,
        OutcomeStatus status,
        String errorDetail,
        Duration elapsed) {

    public ScrapeOutcome {
        listings = listings == null ? List.of() : List.copyOf(listings);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public int acceptedCount() {
        return listings.size();
    }

    public double averageScore() {
        return listings.stream().mapToDouble(JobListing::getQualityScore).average().orElse(0.0);
    }
}
