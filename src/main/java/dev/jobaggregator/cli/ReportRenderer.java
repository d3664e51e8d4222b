package dev.jobaggregator.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobaggregator.config.QueriesConfig.Category;
import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.SalaryStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders search results as text (Thymeleaf TEXT templates under {@code templates/report})
 * or JSON.
 */
@Component
@RequiredArgsConstructor
public class ReportRenderer {

    static final String SEPARATOR = "========================================";

    private final TemplateEngine templateEngine;
    private final ObjectMapper objectMapper;

    /**
     * One ranked listing, preformatted for display.
     */
    public record ListingView(int rank, String title, String company, String location, String salary,
            String score, String source, String alternates, String skills, String url) {
    }

    /**
     * @param label what was searched, e.g. the query text or the category name
     */
    public String render(AggregatedResult result, String label, CliOptions.OutputFormat format) {
        if (format == CliOptions.OutputFormat.JSON) {
            return toJson(result, label);
        }
        String template = switch (format) {
            case BRIEF -> "report/brief";
            case COUNT_ONLY -> "report/counts";
            default -> "report/full";
        };
        Context context = new Context(Locale.ROOT);
        context.setVariable("separator", SEPARATOR);
        context.setVariable("label", label);
        context.setVariable("result", result);
        context.setVariable("listings", views(result.listings()));
        context.setVariable("salary", salarySummary(result.salaryStats()));
        context.setVariable("technologies", topTechnologies(result.technologyBreakdown(), 10));
        context.setVariable("durationSeconds", String.format(Locale.ROOT, "%.1f", result.duration().toMillis() / 1000.0));
        context.setVariable("failed", result.failedSources());
        return templateEngine.process(template, context).strip() + System.lineSeparator();
    }

    public String renderCategories(List<Category> categories) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("separator", SEPARATOR);
        context.setVariable("categories", categories);
        return templateEngine.process("report/categories", context).strip() + System.lineSeparator();
    }

    String toJson(AggregatedResult result, String label) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("query", label);
        document.put("result", result);
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize search result", e);
        }
    }

    List<ListingView> views(List<JobListing> listings) {
        List<ListingView> views = new ArrayList<>(listings.size());
        for (int i = 0; i < listings.size(); i++) {
            JobListing listing = listings.get(i);
            views.add(new ListingView(
                    i + 1,
                    listing.getTitle(),
                    orDash(listing.getCompany()),
                    orDash(listing.getLocation()),
                    formatSalary(listing),
                    String.format(Locale.ROOT, "%.2f", listing.getQualityScore()),
                    listing.getSource(),
                    String.join(", ", listing.getAlternateSources()),
                    String.join(", ", listing.getSkills()),
                    listing.getUrl()));
        }
        return views;
    }

    static String formatSalary(JobListing listing) {
        if (!listing.isSalaryPresent()) {
            return "-";
        }
        if (listing.getSalaryMin() != null && listing.getSalaryMax() != null) {
            return money(listing.getSalaryMin()) + " - " + money(listing.getSalaryMax());
        }
        return listing.getSalaryMin() != null ? money(listing.getSalaryMin()) + "+" : "up to " + money(listing.getSalaryMax());
    }

    private static String salarySummary(SalaryStats stats) {
        if (stats == null || !stats.hasData()) {
            return "no salary data";
        }
        return String.format(Locale.ROOT, "%s - %s, median %s, average %s (%d of %d listings, %.0f%%)",
                money(stats.min()), money(stats.max()), money(stats.median()),
                money((int) Math.round(stats.average())), stats.listingsWithSalary(), stats.totalListings(),
                stats.coveragePercent());
    }

    private static List<String> topTechnologies(Map<String, Integer> breakdown, int limit) {
        return breakdown.entrySet().stream()
                .limit(limit)
                .map(entry -> entry.getKey() + " (" + entry.getValue() + ")")
                .toList();
    }

    private static String money(Integer amount) {
        return "$" + NumberFormat.getIntegerInstance(Locale.US).format(amount);
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
