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

@Component
public class IndeedSource extends AbstractSourceAdapter {

    public static final String SOURCE_ID = "indeed";
    private static final int PAGE_SIZE = 10;

    public IndeedSource(SourcesConfig sourcesConfig, FilterConfig filterConfig, BrowserAutomation browser,
            ScraperProperties scraper) {
        super(SOURCE_ID, "https://www.indeed.com", sourcesConfig, filterConfig, browser, scraper);
    }

    @Override
    protected String buildSearchUrl(SearchQuery query, int page) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/jobs?q=").append(encode(query.effectiveText()))
                .append("&l=").append(encode(query.location()))
                .append("&fromage=14");
        if (page > 1) {
            url.append("&start=").append((page - 1) * PAGE_SIZE);
        }
        return url.toString();
    }

    @Override
    protected String cardSelector() {
        return "div.job_seen_beacon";
    }

    @Override
    protected Optional<JobListing> extractListing(PageElement card) {
        Optional<String> title = card.extractText("h2.jobTitle span[title], h2.jobTitle");
        Optional<String> url = card.extractAttribute("h2.jobTitle a", "abs:href");
        if (title.isEmpty() || url.isEmpty()) {
            return Optional.empty();
        }
        String salary = card.extractText(".salary-snippet-container, .estimated-salary").orElse(null);
        JobListing.JobListingBuilder builder = baseListing()
                .title(ListingTextParser.clean(title.get()))
                .url(url.get())
                .company(card.extractText("[data-testid=company-name], .companyName").orElse(""))
                .location(card.extractText("[data-testid=text-location], .companyLocation").orElse(""))
                .description(ListingTextParser.clean(card.extractText(".job-snippet").orElse("")));
        return Optional.of(classify(builder, salary, card.text()).build());
    }

    @Override
    protected boolean hasNextPage(BrowserSession session, int page) {
        return session.exists("a[data-testid=pagination-page-next]");
    }

    @Override
    protected String noResultsSelector() {
        return ".jobsearch-NoResult-messageContainer";
    }

    @Override
    protected String challengeSelector() {
        return "#challenge-form, .cf-turnstile";
    }
}
