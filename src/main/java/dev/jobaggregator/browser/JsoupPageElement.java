package dev.jobaggregator.browser;

import org.jsoup.nodes.Element;

import java.util.Optional;

/**
 * {@link PageElement} over a parsed Jsoup element.
 */
record JsoupPageElement(Element element) implements PageElement {

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public Optional<String> extractText(String selector) {
        return Optional.ofNullable(element.selectFirst(selector))
                .map(Element::text)
                .map(String::strip)
                .filter(text -> !text.isEmpty());
    }

    @Override
    public Optional<String> extractAttribute(String selector, String attribute) {
        return Optional.ofNullable(element.selectFirst(selector))
                .flatMap(match -> nonBlankAttribute(match, attribute));
    }

    @Override
    public Optional<String> attribute(String attribute) {
        return nonBlankAttribute(element, attribute);
    }

    static Optional<String> nonBlankAttribute(Element element, String attribute) {
        String value = element.attr(attribute);
        return value.isBlank() ? Optional.empty() : Optional.of(value.strip());
    }
}
