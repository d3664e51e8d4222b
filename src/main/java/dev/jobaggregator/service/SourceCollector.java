package dev.jobaggregator.service;

import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.OutcomeStatus;
import dev.jobaggregator.model.ScrapeOutcome;
import dev.jobaggregator.model.SourceConfig;
import dev.jobaggregator.service.QualityFilter.FilterDecision;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-source accumulator for one run. Once frozen, by completion or by the run deadline,
 * later listings are ignored.
 */
final class SourceCollector {

    private final SourceConfig config;
    private final String queryText;
    private final boolean strict;
    private final QualityFilter qualityFilter;

    private final List<JobListing> accepted = new ArrayList<>();
    private int raw;
    private int filtered;
    private OutcomeStatus status;
    private String errorDetail;
    private boolean frozen;
    private long startedNanos;
    private long finishedNanos;

    SourceCollector(SourceConfig config, String queryText, boolean strict, QualityFilter qualityFilter) {
        this.config = config;
        this.queryText = queryText;
        this.strict = strict;
        this.qualityFilter = qualityFilter;
    }

    String sourceId() {
        return config.sourceId();
    }

    synchronized void start() {
        startedNanos = System.nanoTime();
    }

    synchronized void offer(JobListing listing) {
        if (frozen) {
            return;
        }
        int index = raw++;
        FilterDecision decision = qualityFilter.evaluate(listing, config, strict);
        if (decision.accepted()) {
            accepted.add(listing.withQualityScore(decision.score()).withDiscoveryIndex(index));
        } else {
            filtered++;
        }
    }

    /**
     * Record the terminal status unless already frozen.
     *
     * @return {@code true} if this call set the status
     */
    synchronized boolean complete(OutcomeStatus terminal, String detail) {
        if (frozen) {
            return false;
        }
        frozen = true;
        status = terminal;
        errorDetail = detail;
        finishedNanos = System.nanoTime();
        return true;
    }

    synchronized ScrapeOutcome toOutcome() {
        Duration elapsed = startedNanos == 0 ? Duration.ZERO : Duration.ofNanos(finishedNanos - startedNanos);
        return new ScrapeOutcome(config.sourceId(), config.priority(), queryText, accepted, raw, filtered,
                status, errorDetail, elapsed);
    }
}
