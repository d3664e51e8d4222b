package dev.jobaggregator.browser;

import java.util.List;
import java.util.Optional;

/**
 * A single page-loading context. Query methods refer to the most recently loaded page.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Load a page.
     *
     * @return {@code false} on transport failure or a 5xx response
     */
    boolean navigate(String url);

    /**
     * HTTP status of the last navigation, 0 when nothing was received.
     */
    int statusCode();

    String title();

    Optional<String> extractText(String selector);

    /**
     * First match's attribute. Jsoup's {@code abs:} prefix resolves relative URLs.
     */
    Optional<String> extractAttribute(String selector, String attribute);

    List<PageElement> selectAll(String selector);

    boolean exists(String selector);

    @Override
    void close();
}
