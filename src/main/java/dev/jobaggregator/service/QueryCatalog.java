package dev.jobaggregator.service;

import dev.jobaggregator.config.QueriesConfig;
import dev.jobaggregator.config.QueriesConfig.Category;
import dev.jobaggregator.error.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Predefined search queries grouped by category.
 */
@Service
@RequiredArgsConstructor
public class QueryCatalog {

    private final QueriesConfig queriesConfig;

    public List<String> categoryNames() {
        return queriesConfig.getCategories().stream().map(Category::getName).toList();
    }

    public List<Category> categories() {
        return List.copyOf(queriesConfig.getCategories());
    }

    /**
     * Category by name, ignoring case.
     *
     * @throws ConfigurationException if no such category exists
     */
    public Category category(String name) {
        return queriesConfig.getCategories().stream()
                .filter(category -> category.getName().equalsIgnoreCase(name == null ? "" : name.strip()))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown category '" + name + "'. Available: " + String.join(", ", categoryNames())));
    }

    public List<String> queriesFor(String categoryName) {
        return List.copyOf(category(categoryName).getQueries());
    }

    /**
     * Every query once, in category order.
     */
    public List<String> allQueries() {
        LinkedHashSet<String> queries = new LinkedHashSet<>();
        queriesConfig.getCategories().forEach(category -> queries.addAll(category.getQueries()));
        return List.copyOf(queries);
    }

    public String randomQuery() {
        return randomQuery(ThreadLocalRandom.current());
    }

    public String randomQuery(Random random) {
        List<String> queries = allQueries();
        if (queries.isEmpty()) {
            throw new ConfigurationException("No queries configured");
        }
        return queries.get(random.nextInt(queries.size()));
    }

    /**
     * Queries containing the keyword, ignoring case.
     */
    public List<String> search(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        String needle = keyword.strip().toLowerCase(Locale.ROOT);
        return allQueries().stream()
                .filter(query -> query.toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }
}
