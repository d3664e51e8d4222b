package dev.jobaggregator.source.impl;

import dev.jobaggregator.browser.BrowserAutomation;
import dev.jobaggregator.browser.BrowserSession;
import dev.jobaggregator.browser.PageElement;
import dev.jobaggregator.config.FilterConfig;
import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.config.SourcesConfig;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.source.ListingTextParser;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * LinkedIn public (signed-out) job search.
 */
@Component
public class LinkedInSource extends AbstractSourceAdapter {

    public static final String SOURCE_ID = "linkedin";
    private static final int PAGE_SIZE = 25;

    public LinkedInSource(SourcesConfig sourcesConfig, FilterConfig filterConfig, BrowserAutomation browser,
            ScraperProperties scraper) {
        super(SOURCE_ID, "https://www.linkedin.com", sourcesConfig, filterConfig, browser, scraper);
    }

    @Override
    protected String buildSearchUrl(SearchQuery query, int page) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/jobs/search?keywords=").append(encode(query.effectiveText()))
                .append("&location=").append(encode(query.location()))
                .append("&f_TPR=r604800");
        if (page > 1) {
            url.append("&start=").append((page - 1) * PAGE_SIZE);
        }
        return url.toString();
    }

    @Override
    protected String cardSelector() {
        return "div.base-search-card";
    }

    @Override
    protected Optional<JobListing> extractListing(PageElement card) {
        Optional<String> title = card.extractText("h3.base-search-card__title");
        Optional<String> url = card.extractAttribute("a.base-card__full-link", "abs:href");
        if (title.isEmpty() || url.isEmpty()) {
            return Optional.empty();
        }
        String salary = card.extractText(".job-search-card__salary-info").orElse(null);
        // Guest cards carry no snippet; the card text stands in for the description
        String description = card.extractText(".job-search-card__snippet").orElse(card.text());
        JobListing.JobListingBuilder builder = baseListing()
                .title(ListingTextParser.clean(title.get()))
                .url(url.get())
                .company(card.extractText("h4.base-search-card__subtitle").orElse(""))
                .location(card.extractText(".job-search-card__location").orElse(""))
                .description(ListingTextParser.clean(description));
        return Optional.of(classify(builder, salary, card.text()).build());
    }

    @Override
    protected boolean hasNextPage(BrowserSession session, int page) {
        return session.exists("a[rel=next], button.infinite-scroller__show-more-button");
    }

    @Override
    protected String noResultsSelector() {
        return "section.no-results, .results-context-header__no-results";
    }

    @Override
    protected String challengeSelector() {
        return "form#captcha-internal, .authwall-join-form";
    }
}
