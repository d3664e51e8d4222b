package dev.jobaggregator.source.impl;

import dev.jobaggregator.browser.BrowserAutomation;
import dev.jobaggregator.browser.BrowserSession;
import dev.jobaggregator.browser.PageElement;
import dev.jobaggregator.config.FilterConfig;
import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.config.SourcesConfig;
import dev.jobaggregator.error.BlockedException;
import dev.jobaggregator.error.NetworkException;
import dev.jobaggregator.error.PageParseException;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.model.SourceConfig;
import dev.jobaggregator.ratelimit.RateLimiter;
import dev.jobaggregator.source.ListingTextParser;
import dev.jobaggregator.source.SourceAdapter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Shared paging, blocking detection and retry logic for HTML search-result sites.
 * Subclasses only describe their URLs and markup.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    static final List<String> DENIAL_TITLE_MARKERS = List.of(
            "access denied", "captcha", "just a moment", "security check", "unusual traffic",
            "attention required", "are you a robot", "verify you are human", "request blocked");

    protected final SourceConfig config;
    protected final String baseUrl;
    private final BrowserAutomation browser;
    private final ScraperProperties scraper;

    protected AbstractSourceAdapter(String sourceId, String defaultBaseUrl, SourcesConfig sourcesConfig,
            FilterConfig filterConfig, BrowserAutomation browser, ScraperProperties scraper) {
        this.config = sourcesConfig.toSourceConfig(sourceId, filterConfig);
        this.baseUrl = stripTrailingSlash(config.baseUrl() != null && !config.baseUrl().isBlank()
                ? config.baseUrl() : defaultBaseUrl);
        this.browser = browser;
        this.scraper = scraper;
    }

    /**
     * Search URL for a 1-based page number.
     */
    protected abstract String buildSearchUrl(SearchQuery query, int page);

    /**
     * Selector matching one result card.
     */
    protected abstract String cardSelector();

    /**
     * Extract a listing from a card, or empty when the card lacks a title or URL.
     */
    protected abstract Optional<JobListing> extractListing(PageElement card);

    protected abstract boolean hasNextPage(BrowserSession session, int page);

    /**
     * Marker the site shows when a search legitimately matches nothing.
     */
    protected String noResultsSelector() {
        return null;
    }

    /**
     * Marker of an interstitial challenge page.
     */
    protected String challengeSelector() {
        return null;
    }

    @Override
    public SourceConfig getConfig() {
        return config;
    }

    @Override
    public String getSourceId() {
        return config.sourceId();
    }

    @Override
    public Flux<JobListing> fetchRaw(SearchQuery query, int maxPages, RateLimiter.Session limiter) {
        int pages = Math.max(1, maxPages);
        return Flux.using(
                () -> browser.openSession(getSourceId()),
                session -> Flux.range(1, pages)
                        .concatMap(page -> fetchPage(session, limiter, query, page, pages), 1)
                        .takeUntil(result -> !result.hasNext())
                        .concatMapIterable(PageResult::listings),
                BrowserSession::close);
    }

    private Mono<PageResult> fetchPage(BrowserSession session, RateLimiter.Session limiter, SearchQuery query,
            int page, int maxPages) {
        String url = buildSearchUrl(query, page);
        return Mono.fromCallable(() -> loadPage(session, limiter, url, page, maxPages))
                .retryWhen(Retry.backoff(Math.max(0, scraper.getNetworkRetries()), scraper.getRetryBackoff())
                        .filter(NetworkException.class::isInstance)
                        .scheduler(Schedulers.boundedElastic())
                        .doBeforeRetry(signal -> log.warn("{} - retrying page {} after: {}",
                                getSourceId(), page, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private PageResult loadPage(BrowserSession session, RateLimiter.Session limiter, String url, int page,
            int maxPages) {
        limiter.acquire(getSourceId());
        log.debug("{} - loading page {}: {}", getSourceId(), page, url);

        boolean loaded = session.navigate(url);
        int status = session.statusCode();
        if (status == 403 || status == 429) {
            throw new BlockedException(getSourceId(), "HTTP " + status + " on page " + page);
        }
        if (!loaded) {
            throw new NetworkException(getSourceId(),
                    "Navigation failed for page " + page + (status > 0 ? " (HTTP " + status + ")" : ""));
        }
        if (status >= 400) {
            throw new NetworkException(getSourceId(), "HTTP " + status + " on page " + page);
        }
        detectChallenge(session, page);

        List<PageElement> cards = session.selectAll(cardSelector());
        if (cards.isEmpty()) {
            if (page == 1 && !hasNoResultsMarker(session)) {
                throw new BlockedException(getSourceId(), "No result cards on page 1 and no empty-results marker");
            }
            log.debug("{} - page {} has no results", getSourceId(), page);
            return new PageResult(List.of(), false);
        }

        List<JobListing> listings = new ArrayList<>();
        for (PageElement card : cards) {
            extractListing(card).ifPresent(listings::add);
        }
        if (listings.isEmpty()) {
            throw new PageParseException(getSourceId(),
                    cards.size() + " cards on page " + page + " but none could be extracted");
        }
        if (listings.size() < cards.size()) {
            log.debug("{} - skipped {} incomplete cards on page {}", getSourceId(),
                    cards.size() - listings.size(), page);
        }
        boolean more = page < maxPages && hasNextPage(session, page);
        return new PageResult(listings, more);
    }

    private void detectChallenge(BrowserSession session, int page) {
        String title = session.title() == null ? "" : session.title().toLowerCase(Locale.ROOT);
        for (String marker : DENIAL_TITLE_MARKERS) {
            if (title.contains(marker)) {
                throw new BlockedException(getSourceId(), "Denial page on page " + page + ": \"" + session.title() + "\"");
            }
        }
        String challenge = challengeSelector();
        if (challenge != null && session.exists(challenge)) {
            throw new BlockedException(getSourceId(), "Challenge element present on page " + page);
        }
    }

    private boolean hasNoResultsMarker(BrowserSession session) {
        String marker = noResultsSelector();
        return marker != null && session.exists(marker);
    }

    /**
     * Builder pre-filled with the source id and discovery time.
     */
    protected JobListing.JobListingBuilder baseListing() {
        return JobListing.builder()
                .source(getSourceId())
                .discoveredAt(Instant.now());
    }

    /**
     * Fill salary, job type, remote type and skills from the card's free text.
     */
    protected JobListing.JobListingBuilder classify(JobListing.JobListingBuilder builder, String salaryText,
            String detailText) {
        ListingTextParser.SalaryRange salary = ListingTextParser.parseSalary(salaryText);
        builder.salaryMin(salary.min())
                .salaryMax(salary.max())
                .salaryText(salary.isPresent() ? ListingTextParser.clean(salaryText) : null)
                .jobType(ListingTextParser.parseJobType(detailText))
                .remoteType(ListingTextParser.parseRemoteType(detailText));
        ListingTextParser.extractSkills(detailText, config.techKeywords()).forEach(builder::skill);
        return builder;
    }

    protected String absoluteUrl(String href) {
        return ListingTextParser.resolveUrl(baseUrl + "/", href);
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record PageResult(List<JobListing> listings, boolean hasNext) {
    }
}
