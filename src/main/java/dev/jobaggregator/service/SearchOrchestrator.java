package dev.jobaggregator.service;

import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.error.BlockedException;
import dev.jobaggregator.error.ConfigurationException;
import dev.jobaggregator.error.RateBudgetExhaustedException;
import dev.jobaggregator.error.ScrapeException;
import dev.jobaggregator.metrics.SearchMetrics;
import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.model.OutcomeStatus;
import dev.jobaggregator.model.ScrapeOutcome;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.ratelimit.RatePolicy;
import dev.jobaggregator.ratelimit.RateLimiter;
import dev.jobaggregator.source.SourceAdapter;
import dev.jobaggregator.source.SourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one search across the selected sources.
 * <p>
 * Sources run concurrently, up to {@code scraper.max-concurrent-sources} at a time, on the
 * bounded-elastic scheduler. Every raw listing passes the quality filter as it arrives.
 * Source failures end only that source; the run deadline cancels whatever is still running
 * and keeps what it had collected. Each run paces its requests through its own rate-limiter
 * session, so runs in flight at the same time never share request budgets.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchOrchestrator {

    private static final String SEPARATOR = "========================================";

    private final SourceRegistry sourceRegistry;
    private final QualityFilter qualityFilter;
    private final RateLimiter rateLimiter;
    private final ResultAggregator resultAggregator;
    private final ScraperProperties properties;
    private final SearchMetrics metrics;

    private final AtomicReference<SearchRun> lastRun = new AtomicReference<>();

    /**
     * Execute a search.
     *
     * @return the aggregated result, or a {@link ConfigurationException} error before any
     *         source is contacted when the query or configuration is unusable
     */
    public Mono<AggregatedResult> search(SearchQuery query) {
        return Mono.defer(() -> {
            SearchRun run = new SearchRun(query);
            lastRun.set(run);
            List<SourceAdapter> selected = selectSources(query);

            run.advance(SearchRun.State.DISPATCHING);
            log.info(SEPARATOR);
            log.info("Search '{}' in '{}' on {}", query.effectiveText(), query.location(),
                    selected.stream().map(SourceAdapter::getSourceId).toList());
            log.info(SEPARATOR);

            Map<String, RatePolicy> policies = new LinkedHashMap<>();
            Map<String, SourceCollector> collectors = new LinkedHashMap<>();
            for (SourceAdapter adapter : selected) {
                policies.put(adapter.getSourceId(), RatePolicy.of(adapter.getConfig()));
                collectors.put(adapter.getSourceId(),
                        new SourceCollector(adapter.getConfig(), query.effectiveText(), query.strict(), qualityFilter));
            }
            RateLimiter.Session limiter = rateLimiter.openSession(policies);
            run.attach(limiter);

            long startNanos = System.nanoTime();
            return Flux.fromIterable(selected)
                    .flatMap(adapter -> runSource(adapter, query, limiter, collectors.get(adapter.getSourceId())),
                            Math.max(1, properties.getMaxConcurrentSources()))
                    .take(properties.getRunTimeout())
                    .then(Mono.fromCallable(() -> {
                        run.advance(SearchRun.State.COLLECTING);
                        return finish(run, collectors, Duration.ofNanos(System.nanoTime() - startNanos));
                    }));
        });
    }

    public Optional<SearchRun> lastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    private Mono<Void> runSource(SourceAdapter adapter, SearchQuery query, RateLimiter.Session limiter,
            SourceCollector collector) {
        String sourceId = adapter.getSourceId();
        return adapter.fetchRaw(query, query.pagesFor(adapter.getConfig()), limiter)
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSubscribe(subscription -> {
                    collector.start();
                    log.info("Scraping {}", sourceId);
                })
                .doOnNext(collector::offer)
                .then(Mono.fromRunnable(() -> collector.complete(OutcomeStatus.OK, null)))
                .onErrorResume(error -> {
                    OutcomeStatus status = statusFor(error);
                    if (collector.complete(status, error.getMessage())) {
                        log.warn("{} finished {}: {}", sourceId, status, error.getMessage());
                        if (status == OutcomeStatus.ERROR && !(error instanceof ScrapeException)) {
                            log.debug("{} unexpected failure", sourceId, error);
                        }
                    }
                    return Mono.empty();
                })
                .then();
    }

    private AggregatedResult finish(SearchRun run, Map<String, SourceCollector> collectors, Duration duration) {
        for (SourceCollector collector : collectors.values()) {
            if (collector.complete(OutcomeStatus.PARTIAL, "Run timeout after " + properties.getRunTimeout())) {
                log.warn("{} cancelled at the run deadline", collector.sourceId());
            }
        }
        List<ScrapeOutcome> outcomes = collectors.values().stream()
                .map(SourceCollector::toOutcome)
                .toList();
        outcomes.forEach(metrics::recordOutcome);

        AggregatedResult result = resultAggregator.aggregate(outcomes, duration);
        run.advance(SearchRun.State.DONE);

        log.info(SEPARATOR);
        log.info("SEARCH SUMMARY: {} listings ({} raw, {} filtered out) in {} ms",
                result.listings().size(), result.totalRaw(), result.totalFiltered(), duration.toMillis());
        outcomes.forEach(outcome -> log.info("  {} -> {} ({} accepted of {})",
                outcome.sourceId(), outcome.status(), outcome.acceptedCount(), outcome.rawCount()));
        log.info(SEPARATOR);
        return result;
    }

    /**
     * Adapters to run, in priority order.
     *
     * @throws ConfigurationException for unknown ids, no runnable source or invalid settings
     */
    List<SourceAdapter> selectSources(SearchQuery query) {
        List<SourceAdapter> selected;
        if (query.enabledSources().isEmpty()) {
            selected = sourceRegistry.enabled();
        } else {
            Set<String> unknown = new TreeSet<>(query.enabledSources());
            unknown.removeAll(sourceRegistry.sourceIds());
            if (!unknown.isEmpty()) {
                throw new ConfigurationException("Unknown source(s): " + String.join(", ", unknown)
                        + ". Available: " + String.join(", ", sourceRegistry.sourceIds()));
            }
            selected = sourceRegistry.all().stream()
                    .filter(adapter -> query.enabledSources().contains(adapter.getSourceId()))
                    .toList();
        }
        if (selected.isEmpty()) {
            throw new ConfigurationException("No enabled sources to search");
        }
        if (query.text().isBlank()) {
            throw new ConfigurationException("Search query text must not be blank");
        }
        selected.forEach(adapter -> adapter.getConfig().validate());
        return selected;
    }

    static OutcomeStatus statusFor(Throwable error) {
        if (error instanceof BlockedException) {
            return OutcomeStatus.BLOCKED;
        }
        if (error instanceof RateBudgetExhaustedException) {
            return OutcomeStatus.PARTIAL;
        }
        return OutcomeStatus.ERROR;
    }
}
