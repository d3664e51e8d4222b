package dev.jobaggregator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Predefined search query categories.
 * Loaded from application.yml under 'queries' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "queries")
public class QueriesConfig {

    private int maxQueriesPerCategory = 3;
    private List<Category> categories = new ArrayList<>();

    @Data
    public static class Category {
        private String name;
        private String description;
        private List<String> queries = new ArrayList<>();
    }
}
