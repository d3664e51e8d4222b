package dev.jobaggregator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Run-level scraping settings.
 * Loaded from application.yml under 'scraper' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {

    private int maxConcurrentSources = 3;
    private Duration runTimeout = Duration.ofMinutes(5);
    private int networkRetries = 2;
    private Duration retryBackoff = Duration.ofSeconds(2);
    private int maxBrowserContexts = 3;
    private Duration requestTimeout = Duration.ofSeconds(30);
    private String defaultLocation = "United States";
    private String defaultQuery = "LLM engineer";
    private int defaultMaxPages = 2;
    private boolean strict = false;
}
