package dev.jobaggregator.config;

import dev.jobaggregator.model.SourceConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-site scraping settings keyed by source id.
 * Loaded from application.yml under 'sources' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sources")
public class SourcesConfig {

    private Map<String, Site> sites = new LinkedHashMap<>();

    /**
     * Settings for the given source, or defaults when the source is not configured.
     */
    public Site site(String sourceId) {
        return sites.getOrDefault(sourceId, new Site());
    }

    public SourceConfig toSourceConfig(String sourceId, FilterConfig filter) {
        return site(sourceId).toSourceConfig(sourceId, filter);
    }

    @Data
    public static class Site {
        private boolean enabled = true;
        private int priority = 100;
        private int maxPages = 2;
        private Duration minDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(5);
        private int maxRequests = 10;
        private Integer minSalary;
        private Integer maxSalary;
        private Integer strictMinSalary;
        private Integer strictMaxSalary;
        private double minQualityScore = 0.65;
        private double strictMinQualityScore = 0.75;
        private List<String> requiredKeywords = new ArrayList<>();
        private List<String> excludeKeywords = new ArrayList<>();
        private String baseUrl;

        SourceConfig toSourceConfig(String sourceId, FilterConfig filter) {
            return SourceConfig.builder()
                    .sourceId(sourceId)
                    .enabled(enabled)
                    .priority(priority)
                    .maxPages(maxPages)
                    .minDelay(minDelay)
                    .maxDelay(maxDelay)
                    .maxRequests(maxRequests)
                    .minSalary(minSalary)
                    .maxSalary(maxSalary != null ? maxSalary : filter.getMaxSalary())
                    .strictMinSalary(strictMinSalary)
                    .strictMaxSalary(strictMaxSalary != null ? strictMaxSalary : filter.getStrictMaxSalary())
                    .minQualityScore(minQualityScore)
                    .strictMinQualityScore(strictMinQualityScore)
                    .requiredKeywords(requiredKeywords.isEmpty() ? filter.getRequiredKeywords() : requiredKeywords)
                    .excludeKeywords(excludeKeywords.isEmpty() ? filter.getExcludeKeywords() : excludeKeywords)
                    .excludeCompanies(filter.getExcludeCompanies())
                    .techKeywords(filter.getTechKeywords())
                    .allowedJobTypes(filter.getAllowedJobTypes())
                    .allowedRemoteTypes(filter.getAllowedRemoteTypes())
                    .strictAllowedRemoteTypes(filter.getStrictAllowedRemoteTypes())
                    .excludeExperienceLevels(filter.getExcludeExperienceLevels())
                    .strictExcludeExperienceLevels(filter.getStrictExcludeExperienceLevels())
                    .baseUrl(baseUrl)
                    .build();
        }
    }
}
