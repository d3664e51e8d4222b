package dev.jobaggregator.browser;

import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.error.NetworkException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Page loading over plain HTTP: {@link WebClient} fetches the markup with browser-like headers
 * and Jsoup parses it. Concurrent sessions are bounded by a semaphore of
 * {@code scraper.max-browser-contexts} permits.
 */
@Slf4j
@Component
public class JsoupBrowserAutomation implements BrowserAutomation {

    private static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/121.0.0.0 Safari/537.36";

    private final WebClient webClient;
    private final Duration requestTimeout;
    private final Semaphore contexts;

    public JsoupBrowserAutomation(WebClient.Builder webClientBuilder, ScraperProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .httpResponseDecoder(spec -> spec.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .codecs(config -> config.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", USER_AGENT)
                .defaultHeader("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .defaultHeader("Accept-Language", "en-US,en;q=0.9")
                .build();
        this.requestTimeout = properties.getRequestTimeout();
        this.contexts = new Semaphore(Math.max(1, properties.getMaxBrowserContexts()));
    }

    @Override
    public BrowserSession openSession(String sourceId) {
        try {
            contexts.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException(sourceId, "Interrupted while waiting for a browser context", e);
        }
        log.debug("Opened browser session for {} ({} contexts free)", sourceId, contexts.availablePermits());
        return new JsoupBrowserSession(sourceId);
    }

    int availableContexts() {
        return contexts.availablePermits();
    }

    private record PageResponse(int status, String body) {
    }

    private final class JsoupBrowserSession implements BrowserSession {

        private final String sourceId;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private Document document;
        private int statusCode;

        private JsoupBrowserSession(String sourceId) {
            this.sourceId = sourceId;
        }

        @Override
        public boolean navigate(String url) {
            if (closed.get()) {
                throw new IllegalStateException("Session for " + sourceId + " is closed");
            }
            document = null;
            statusCode = 0;
            try {
                PageResponse response = webClient.get()
                        .uri(URI.create(url))
                        .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new PageResponse(clientResponse.statusCode().value(), body)))
                        .block(requestTimeout);
                if (response == null) {
                    return false;
                }
                statusCode = response.status();
                document = Jsoup.parse(response.body(), url);
                return statusCode < 500;
            } catch (RuntimeException e) {
                log.debug("{} - navigation to {} failed: {}", sourceId, url, e.getMessage());
                return false;
            }
        }

        @Override
        public int statusCode() {
            return statusCode;
        }

        @Override
        public String title() {
            return document == null ? "" : document.title();
        }

        @Override
        public Optional<String> extractText(String selector) {
            return first(selector)
                    .map(Element::text)
                    .map(String::strip)
                    .filter(text -> !text.isEmpty());
        }

        @Override
        public Optional<String> extractAttribute(String selector, String attribute) {
            return first(selector).flatMap(element -> JsoupPageElement.nonBlankAttribute(element, attribute));
        }

        @Override
        public List<PageElement> selectAll(String selector) {
            if (document == null) {
                return List.of();
            }
            return document.select(selector).stream()
                    .<PageElement>map(JsoupPageElement::new)
                    .toList();
        }

        @Override
        public boolean exists(String selector) {
            return first(selector).isPresent();
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                document = null;
                contexts.release();
                log.debug("Closed browser session for {}", sourceId);
            }
        }

        private Optional<Element> first(String selector) {
            return document == null ? Optional.empty() : Optional.ofNullable(document.selectFirst(selector));
        }
    }
}
