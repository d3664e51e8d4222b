package dev.jobaggregator.source.impl;

import dev.jobaggregator.browser.BrowserAutomation;
import dev.jobaggregator.browser.BrowserSession;
import dev.jobaggregator.browser.PageElement;
import dev.jobaggregator.config.FilterConfig;
import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.config.SourcesConfig;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.RemoteType;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.source.ListingTextParser;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * RemoteOK board. Every posting is remote, the location filter does not apply, and results
 * come on a single page.
 */
@Component
public class RemoteOkSource extends AbstractSourceAdapter {

    public static final String SOURCE_ID = "remoteok";

    public RemoteOkSource(SourcesConfig sourcesConfig, FilterConfig filterConfig, BrowserAutomation browser,
            ScraperProperties scraper) {
        super(SOURCE_ID, "https://remoteok.com", sourcesConfig, filterConfig, browser, scraper);
    }

    @Override
    protected String buildSearchUrl(SearchQuery query, int page) {
        return baseUrl + "/?search=" + encode(query.effectiveText().toLowerCase(Locale.ROOT));
    }

    @Override
    protected String cardSelector() {
        return "tr.job";
    }

    @Override
    protected Optional<JobListing> extractListing(PageElement card) {
        Optional<String> title = card.extractText("h2[itemprop=title], h2");
        Optional<String> url = card.extractAttribute("a[itemprop=url], a.preventLink", "abs:href")
                .or(() -> card.attribute("abs:data-href"));
        if (title.isEmpty() || url.isEmpty()) {
            return Optional.empty();
        }
        String salary = card.extractText(".salary").orElse(null);
        String tags = card.extractText("td.tags").orElse("");
        JobListing.JobListingBuilder builder = baseListing()
                .title(ListingTextParser.clean(title.get()))
                .url(url.get())
                .company(card.extractText("h3[itemprop=name], h3").orElse(""))
                .location(card.extractText(".location").orElse("Remote"))
                .description(ListingTextParser.clean(card.extractText(".description").orElse(tags)));
        return Optional.of(classify(builder, salary, card.text())
                .remoteType(RemoteType.REMOTE)
                .build());
    }

    @Override
    protected boolean hasNextPage(BrowserSession session, int page) {
        return false;
    }

    @Override
    protected String noResultsSelector() {
        return ".no-results, #no-results";
    }

    @Override
    protected String challengeSelector() {
        return "#challenge-form, .cf-challenge";
    }
}
