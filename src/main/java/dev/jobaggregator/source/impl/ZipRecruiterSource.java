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
public class ZipRecruiterSource extends AbstractSourceAdapter {

    public static final String SOURCE_ID = "ziprecruiter";

    public ZipRecruiterSource(SourcesConfig sourcesConfig, FilterConfig filterConfig, BrowserAutomation browser,
            ScraperProperties scraper) {
        super(SOURCE_ID, "https://www.ziprecruiter.com", sourcesConfig, filterConfig, browser, scraper);
    }

    @Override
    protected String buildSearchUrl(SearchQuery query, int page) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append("/jobs-search?search=").append(encode(query.effectiveText()));
        if (!query.location().isEmpty()) {
            url.append("&location=").append(encode(query.location()));
        }
        url.append("&days=7");
        if (page > 1) {
            url.append("&page=").append(page);
        }
        return url.toString();
    }

    @Override
    protected String cardSelector() {
        return "article.job_result";
    }

    @Override
    protected Optional<JobListing> extractListing(PageElement card) {
        Optional<String> title = card.extractText("h2.title, .job_title");
        Optional<String> url = card.extractAttribute("a.job_link, h2.title a", "abs:href");
        if (title.isEmpty() || url.isEmpty()) {
            return Optional.empty();
        }
        String salary = card.extractText(".salary, [data-testid=job-card-salary]").orElse(null);
        JobListing.JobListingBuilder builder = baseListing()
                .title(ListingTextParser.clean(title.get()))
                .url(url.get())
                .company(card.extractText(".company_name, [data-testid=job-card-company]").orElse(""))
                .location(card.extractText(".company_location, [data-testid=job-card-location]").orElse(""))
                .description(ListingTextParser.clean(card.extractText(".job_snippet").orElse("")));
        return Optional.of(classify(builder, salary, card.text()).build());
    }

    @Override
    protected boolean hasNextPage(BrowserSession session, int page) {
        return session.exists("a[rel=next], .pagination-next:not(.disabled), [data-testid=next-page]");
    }

    @Override
    protected String noResultsSelector() {
        return ".no-results, .zrs_no_results";
    }

    @Override
    protected String challengeSelector() {
        return "#challenge-form, .cf-challenge, #px-captcha";
    }
}
