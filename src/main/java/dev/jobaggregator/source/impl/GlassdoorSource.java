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
 * Glassdoor search results. Disabled in the default configuration: the site challenges most
 * unauthenticated traffic.
 */
@Component
public class GlassdoorSource extends AbstractSourceAdapter {

    public static final String SOURCE_ID = "glassdoor";

    public GlassdoorSource(SourcesConfig sourcesConfig, FilterConfig filterConfig, BrowserAutomation browser,
            ScraperProperties scraper) {
        super(SOURCE_ID, "https://www.glassdoor.com", sourcesConfig, filterConfig, browser, scraper);
    }

    @Override
    protected String buildSearchUrl(SearchQuery query, int page) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/Job/jobs.htm?sc.keyword=").append(encode(query.effectiveText()))
                .append("&locKeyword=").append(encode(query.location()))
                .append("&fromAge=14");
        if (page > 1) {
            url.append("&p=").append(page);
        }
        return url.toString();
    }

    @Override
    protected String cardSelector() {
        return "li[data-test=jobListing]";
    }

    @Override
    protected Optional<JobListing> extractListing(PageElement card) {
        Optional<String> title = card.extractText("[data-test=job-title]");
        Optional<String> url = card.extractAttribute("a[data-test=job-title], a[data-test=job-link]", "abs:href");
        if (title.isEmpty() || url.isEmpty()) {
            return Optional.empty();
        }
        String salary = card.extractText("[data-test=detailSalary]").orElse(null);
        JobListing.JobListingBuilder builder = baseListing()
                .title(ListingTextParser.clean(title.get()))
                .url(url.get())
                .company(card.extractText("[data-test=employer-name], .employer-name").orElse(""))
                .location(card.extractText("[data-test=emp-location]").orElse(""))
                .description(ListingTextParser.clean(card.extractText("[data-test=descSnippet]").orElse("")));
        return Optional.of(classify(builder, salary, card.text()).build());
    }

    @Override
    protected boolean hasNextPage(BrowserSession session, int page) {
        return session.exists("button[data-test=pagination-next]:not([disabled]), a[data-test=pagination-next]");
    }

    @Override
    protected String noResultsSelector() {
        return "[data-test=no-results]";
    }

    @Override
    protected String challengeSelector() {
        return "#px-captcha, .cf-challenge";
    }
}
