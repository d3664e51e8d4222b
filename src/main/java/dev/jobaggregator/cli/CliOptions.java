package dev.jobaggregator.cli;

import dev.jobaggregator.error.ConfigurationException;
import dev.jobaggregator.model.SearchQuery;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed command line.
 *
 * @param mode        which kind of search to run
 * @param query       query text for a single search
 * @param category    category name for a category search
 * @param queries     explicit queries for a multi-query search
 * @param location    location override
 * @param maxPages    per-source page override
 * @param sources     source ids to query; empty means every enabled source
 * @param seniority   seniority hint
 * @param strict      strict filtering
 * @param maxJobs     listings to print (and per-query cap for batch searches)
 * @param format      output format
 */
public record CliOptions(
        Mode mode,
        String query,
        String category,
        List<String> queries,
        String location,
        Integer maxPages,
        Set<String> sources,
        String seniority,
        boolean strict,
        int maxJobs,
        OutputFormat format) {

    static final int DEFAULT_MAX_JOBS = 25;

    public enum Mode {
        SINGLE, RANDOM, CATEGORY, MULTI, COMPREHENSIVE, LIST_CATEGORIES
    }

    public enum OutputFormat {
        FULL, BRIEF, COUNT_ONLY, JSON
    }

    public static CliOptions parse(String... args) {
        return from(new DefaultApplicationArguments(args));
    }

    /**
     * @throws ConfigurationException for malformed numbers or conflicting modes
     */
    public static CliOptions from(ApplicationArguments args) {
        List<Mode> modes = new ArrayList<>();
        if (args.containsOption("random")) {
            modes.add(Mode.RANDOM);
        }
        if (args.containsOption("category")) {
            modes.add(Mode.CATEGORY);
        }
        if (args.containsOption("queries")) {
            modes.add(Mode.MULTI);
        }
        if (args.containsOption("comprehensive")) {
            modes.add(Mode.COMPREHENSIVE);
        }
        if (args.containsOption("list-categories")) {
            modes.add(Mode.LIST_CATEGORIES);
        }
        if (modes.size() > 1) {
            throw new ConfigurationException("Conflicting options: " + modes);
        }
        Mode mode = modes.isEmpty() ? Mode.SINGLE : modes.get(0);

        String query = value(args, "query");
        if (query == null && !args.getNonOptionArgs().isEmpty()) {
            query = String.join(" ", args.getNonOptionArgs());
        }

        List<String> queries = split(value(args, "queries"), ";");
        if (mode == Mode.MULTI && queries.isEmpty()) {
            throw new ConfigurationException("--queries needs at least one query, separated by ';'");
        }
        String category = value(args, "category");
        if (mode == Mode.CATEGORY && (category == null || category.isBlank())) {
            throw new ConfigurationException("--category needs a category name");
        }

        OutputFormat format = OutputFormat.FULL;
        if (args.containsOption("json")) {
            format = OutputFormat.JSON;
        } else if (args.containsOption("count-only")) {
            format = OutputFormat.COUNT_ONLY;
        } else if (args.containsOption("brief")) {
            format = OutputFormat.BRIEF;
        }

        Integer maxJobs = integer(args, "max-jobs");
        return new CliOptions(
                mode,
                query,
                category,
                queries,
                value(args, "location"),
                integer(args, "max-pages"),
                sourceIds(value(args, "sources")),
                value(args, "seniority"),
                flag(args, "strict"),
                maxJobs == null ? DEFAULT_MAX_JOBS : maxJobs,
                format);
    }

    /**
     * Query template carrying every option except the text.
     */
    public SearchQuery toQuery(String text) {
        return SearchQuery.builder()
                .text(text)
                .location(location)
                .maxPages(maxPages)
                .seniority(seniority)
                .enabledSources(sources)
                .strict(strict)
                .build();
    }

    private static String value(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String last = values.get(values.size() - 1);
        return last == null || last.isBlank() ? null : last.strip();
    }

    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = value(args, name);
        return value == null || Boolean.parseBoolean(value);
    }

    private static Integer integer(ApplicationArguments args, String name) {
        String value = value(args, name);
        if (value == null) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 1) {
                throw new ConfigurationException("--" + name + " must be at least 1");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + name + " must be a number, got '" + value + "'");
        }
    }

    private static Set<String> sourceIds(String value) {
        Set<String> ids = new LinkedHashSet<>();
        split(value, ",").forEach(id -> ids.add(id.toLowerCase(Locale.ROOT)));
        return ids;
    }

    private static List<String> split(String value, String separator) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(separator))
                .map(String::strip)
                .filter(part -> !part.isEmpty())
                .toList();
    }
}
