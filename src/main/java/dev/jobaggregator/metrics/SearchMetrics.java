package dev.jobaggregator.metrics;

import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.model.ScrapeOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer metrics for search runs.
 */
@Component
public class SearchMetrics {

    private static final String TAG_SOURCE = "source";
    private static final String TAG_STATUS = "status";
    private final MeterRegistry registry;

    // Counters
    private final Counter listingsRawCounter;
    private final Counter listingsFilteredCounter;
    private final Counter listingsReturnedCounter;
    private final Counter duplicatesCounter;
    private final Counter searchesCounter;

    // Timers (per source)
    private final ConcurrentHashMap<String, Timer> sourceTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastRunListings = new AtomicInteger(0);
    private final AtomicInteger lastRunFailedSources = new AtomicInteger(0);
    private final AtomicLong lastRunDurationMs = new AtomicLong(0);

    public SearchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.listingsRawCounter = Counter.builder("job_aggregator_listings_raw_total")
                .description("Raw listings seen across all sources")
                .register(registry);

        this.listingsFilteredCounter = Counter.builder("job_aggregator_listings_filtered_total")
                .description("Listings dropped by the quality filter or as duplicates")
                .register(registry);

        this.listingsReturnedCounter = Counter.builder("job_aggregator_listings_returned_total")
                .description("Listings returned in ranked results")
                .register(registry);

        this.duplicatesCounter = Counter.builder("job_aggregator_duplicates_removed_total")
                .description("Listings merged into another listing")
                .register(registry);

        this.searchesCounter = Counter.builder("job_aggregator_searches_total")
                .description("Completed searches")
                .register(registry);

        Gauge.builder("job_aggregator_last_run_listings", lastRunListings, AtomicInteger::get)
                .description("Listings returned by the last search")
                .register(registry);

        Gauge.builder("job_aggregator_last_run_failed_sources", lastRunFailedSources, AtomicInteger::get)
                .description("Sources that were blocked or failed in the last search")
                .register(registry);

        Gauge.builder("job_aggregator_last_run_duration_ms", lastRunDurationMs, AtomicLong::get)
                .description("Wall-clock duration of the last search")
                .register(registry);
    }

    /**
     * Get or create a timer for a specific source.
     */
    public Timer getSourceTimer(String sourceId) {
        return sourceTimers.computeIfAbsent(sourceId, name ->
                Timer.builder("job_aggregator_source_duration")
                        .description("Time spent scraping a source")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    /**
     * Record the terminal state of one source.
     */
    public void recordOutcome(ScrapeOutcome outcome) {
        getSourceTimer(outcome.sourceId()).record(outcome.elapsed());
        Counter.builder("job_aggregator_source_outcomes_total")
                .tag(TAG_SOURCE, outcome.sourceId())
                .tag(TAG_STATUS, outcome.status().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
        Counter.builder("job_aggregator_listings_accepted_by_source_total")
                .tag(TAG_SOURCE, outcome.sourceId())
                .register(registry)
                .increment(outcome.acceptedCount());
    }

    /**
     * Record a finished search and update last run statistics.
     */
    public void recordResult(AggregatedResult result) {
        searchesCounter.increment();
        listingsRawCounter.increment(result.totalRaw());
        listingsFilteredCounter.increment(result.totalFiltered());
        listingsReturnedCounter.increment(result.listings().size());
        duplicatesCounter.increment(result.duplicatesRemoved());

        lastRunListings.set(result.listings().size());
        lastRunFailedSources.set(result.failedSources().size());
        lastRunDurationMs.set(result.duration().toMillis());
    }
}
