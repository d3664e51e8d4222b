package dev.jobaggregator.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Externally observable output of a search: deduplicated, ranked listings plus the
 * per-source breakdown.
 *
 * @param listings            ranked listings, best first
 * @param totalRaw            raw listings seen across all sources
 * @param totalFiltered       listings dropped, quality rejections plus duplicates
 * @param duplicatesRemoved   listings merged into another listing
 * @param outcomes            per-source outcomes
 * @param duration            wall-clock duration
 * @param technologyBreakdown technology keyword to number of listings mentioning it
 * @param salaryStats         salary figures over the ranked listings
 * @param bestSource          source with the best accepted volume and quality, or "none"
 */
public record AggregatedResult(
        List<JobListing> listings,
        int totalRaw,
        int totalFiltered,
        int duplicatesRemoved,
        List<ScrapeOutcome> outcomes,
        Duration duration,
        Map<String, Integer> technologyBreakdown,
        SalaryStats salaryStats,
        String bestSource) {

    public AggregatedResult {
        listings = listings == null ? List.of() : List.copyOf(listings);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        technologyBreakdown = technologyBreakdown == null ? Map.of() : technologyBreakdown;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public List<String> succeededSources() {
        return outcomes.stream()
                .filter(outcome -> outcome.status().isSuccessful())
                .map(ScrapeOutcome::sourceId)
                .distinct()
                .toList();
    }

    public List<String> failedSources() {
        return outcomes.stream()
                .filter(outcome -> !outcome.status().isSuccessful())
                .map(ScrapeOutcome::sourceId)
                .distinct()
                .toList();
    }

    /**
     * Copy keeping only the first {@code maxListings} ranked listings. Counts are unchanged.
     */
    public AggregatedResult limit(int maxListings) {
        if (maxListings < 0 || listings.size() <= maxListings) {
            return this;
        }
        return new AggregatedResult(listings.subList(0, maxListings), totalRaw, totalFiltered,
                duplicatesRemoved, outcomes, duration, technologyBreakdown, salaryStats, bestSource);
    }
}
