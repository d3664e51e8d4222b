package dev.jobaggregator.model;

import lombok.Builder;

import java.util.Locale;
import java.util.Set;

/**
 * One search invocation: what to look for, where, and on which sources.
 *
 * @param text           free-text query, e.g. "LLM engineer"
 * @param location       location string passed to each source
 * @param maxPages       per-source page override; {@code null} uses each source's default
 * @param seniority      optional seniority hint ("senior", "staff", ...)
 * @param enabledSources source ids to query; empty means every enabled source
 * @param strict         use the strict filter thresholds
 */
@Builder(toBuilder = true)
public record SearchQuery(
        String text,
        String location,
        Integer maxPages,
        String seniority,
        Set<String> enabledSources,
        boolean strict) {

    private static final Set<String> PREFIXED_SENIORITIES = Set.of("senior", "staff", "lead", "principal");

    public SearchQuery {
        text = text == null ? "" : text.strip();
        location = location == null ? "" : location.strip();
        enabledSources = enabledSources == null ? Set.of() : Set.copyOf(enabledSources);
    }

    /**
     * Query text as sent to the sources, prefixed with the seniority hint when it names a
     * senior-track level.
     */
    public String effectiveText() {
        if (seniority == null || seniority.isBlank()) {
            return text;
        }
        String hint = seniority.strip().toLowerCase(Locale.ROOT);
        if ("sr".equals(hint)) {
            hint = "senior";
        }
        if (!PREFIXED_SENIORITIES.contains(hint) || text.toLowerCase(Locale.ROOT).startsWith(hint + " ")) {
            return text;
        }
        return Character.toUpperCase(hint.charAt(0)) + hint.substring(1) + " " + text;
    }

    public int pagesFor(SourceConfig config) {
        int pages = maxPages != null ? maxPages : config.maxPages();
        return Math.max(1, pages);
    }
}
