package dev.jobaggregator.browser;

import java.util.Optional;

/**
 * A matched element on a loaded page, usually one result card.
 */
public interface PageElement {

    String text();

    Optional<String> extractText(String selector);

    Optional<String> extractAttribute(String selector, String attribute);

    /**
     * Attribute of this element itself.
     */
    Optional<String> attribute(String attribute);
}
