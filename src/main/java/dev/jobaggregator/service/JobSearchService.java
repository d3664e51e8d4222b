package dev.jobaggregator.service;

import dev.jobaggregator.config.QueriesConfig;
import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.metrics.SearchMetrics;
import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.model.SearchQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Search entry points: a single query, one category of queries, or a sweep across every
 * category.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobSearchService {

    private final SearchOrchestrator orchestrator;
    private final ResultAggregator resultAggregator;
    private final QueryCatalog queryCatalog;
    private final QueriesConfig queriesConfig;
    private final ScraperProperties properties;
    private final SearchMetrics metrics;

    public Mono<AggregatedResult> search(SearchQuery query) {
        return orchestrator.search(withDefaults(query))
                .doOnNext(metrics::recordResult);
    }

    public Mono<AggregatedResult> searchCategory(String categoryName, int maxJobsPerQuery) {
        return searchCategory(categoryName, maxJobsPerQuery, SearchQuery.builder().build());
    }

    /**
     * Run the first {@code queries.max-queries-per-category} queries of a category one after
     * another, keep the best {@code maxJobsPerQuery} of each and combine them.
     *
     * @param template location, sources, seniority and mode for every query; its text is ignored
     */
    public Mono<AggregatedResult> searchCategory(String categoryName, int maxJobsPerQuery, SearchQuery template) {
        return Mono.defer(() -> {
            List<String> queries = queryCatalog.queriesFor(categoryName).stream()
                    .limit(Math.max(1, queriesConfig.getMaxQueriesPerCategory()))
                    .toList();
            log.info("Category '{}': running {} queries", categoryName, queries.size());
            return runAll(queries, maxJobsPerQuery, template);
        });
    }

    public Mono<AggregatedResult> searchComprehensive(int maxJobsPerCategory) {
        return searchComprehensive(maxJobsPerCategory, SearchQuery.builder().build());
    }

    /**
     * Run the first query of every category and combine the best {@code maxJobsPerCategory}
     * listings of each.
     */
    public Mono<AggregatedResult> searchComprehensive(int maxJobsPerCategory, SearchQuery template) {
        return Mono.defer(() -> {
            List<String> queries = queryCatalog.categories().stream()
                    .filter(category -> !category.getQueries().isEmpty())
                    .map(category -> category.getQueries().get(0))
                    .toList();
            log.info("Comprehensive search: {} categories", queries.size());
            return runAll(queries, maxJobsPerCategory, template);
        });
    }

    /**
     * Run the given queries one after another, keep the best {@code maxJobsPerQuery} of each
     * and combine them.
     */
    public Mono<AggregatedResult> searchQueries(List<String> queries, int maxJobsPerQuery, SearchQuery template) {
        return Mono.defer(() -> runAll(queries, maxJobsPerQuery, template));
    }

    private Mono<AggregatedResult> runAll(List<String> queries, int maxJobs, SearchQuery template) {
        long start = System.nanoTime();
        return Flux.fromIterable(queries)
                .concatMap(text -> orchestrator.search(withBatchDefaults(template.toBuilder().text(text).build()))
                        .map(result -> result.limit(maxJobs)))
                .collectList()
                .map(results -> resultAggregator.combine(results, Duration.ofNanos(System.nanoTime() - start)))
                .doOnNext(metrics::recordResult);
    }

    /**
     * Fill blank text and location from {@code scraper.*}; strict mode is on when either the
     * query or the configuration asks for it.
     */
    SearchQuery withDefaults(SearchQuery query) {
        SearchQuery.SearchQueryBuilder builder = query.toBuilder();
        if (query.text().isBlank()) {
            builder.text(properties.getDefaultQuery());
        }
        if (query.location().isBlank()) {
            builder.location(properties.getDefaultLocation());
        }
        return builder.strict(query.strict() || properties.isStrict()).build();
    }

    /**
     * Batch searches multiply page loads, so they default to {@code scraper.default-max-pages}.
     */
    private SearchQuery withBatchDefaults(SearchQuery query) {
        SearchQuery filled = withDefaults(query);
        if (filled.maxPages() != null) {
            return filled;
        }
        return filled.toBuilder().maxPages(properties.getDefaultMaxPages()).build();
    }
}
