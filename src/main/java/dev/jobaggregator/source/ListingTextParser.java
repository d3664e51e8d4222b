package dev.jobaggregator.source;

import dev.jobaggregator.model.JobType;
import dev.jobaggregator.model.RemoteType;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the site adapters and the quality filter.
 */
public final class ListingTextParser {

    static final int HOURS_PER_YEAR = 2080;
    static final long MAX_ANNUAL_SALARY = 10_000_000L;

    private static final Pattern AMOUNT = Pattern.compile(
            "(\\$\\s*)?(\\d{1,3}(?:,\\d{3})+|\\d+(?:\\.\\d+)?)\\s*([kK])?(?![\\d,])");
    private static final Pattern HOURLY = Pattern.compile("(?i)(per\\s+hour|an\\s+hour|/\\s*h(?:ou)?r|\\bhourly\\b)");
    private static final Pattern MONTHLY = Pattern.compile("(?i)(per\\s+month|a\\s+month|/\\s*mo(?:nth)?\\b|\\bmonthly\\b)");
    private static final Pattern INTERNSHIP = Pattern.compile("(?i)\\bintern(ship)?s?\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, Pattern> KEYWORD_PATTERNS = new ConcurrentHashMap<>();

    private ListingTextParser() {
    }

    /**
     * Annual USD salary bounds, either of which may be absent.
     */
    public record SalaryRange(Integer min, Integer max) {

        public static final SalaryRange NONE = new SalaryRange(null, null);

        public boolean isPresent() {
            return min != null || max != null;
        }
    }

    /**
     * Parse salary text such as "$120,000 - $150,000", "$120K–$150K", "$100k+" or
     * "$60 - $75 an hour". Hourly figures are annualized at 2080 hours, monthly ones at 12
     * months, and bare amounts under 1000 are read as hourly. Figures above
     * {@value #MAX_ANNUAL_SALARY} a year are not salaries and yield {@link SalaryRange#NONE}.
     */
    public static SalaryRange parseSalary(String text) {
        if (text == null || text.isBlank()) {
            return SalaryRange.NONE;
        }
        Matcher matcher = AMOUNT.matcher(text);
        List<Double> amounts = new ArrayList<>();
        List<Boolean> thousands = new ArrayList<>();
        while (matcher.find() && amounts.size() < 2) {
            boolean dollar = matcher.group(1) != null;
            boolean kilo = matcher.group(3) != null;
            if (!dollar && !kilo) {
                continue;
            }
            amounts.add(Double.parseDouble(matcher.group(2).replace(",", "")));
            thousands.add(kilo);
        }
        if (amounts.isEmpty()) {
            return SalaryRange.NONE;
        }
        // "$120-150K": the suffix on the upper bound applies to both
        boolean anyKilo = thousands.contains(Boolean.TRUE);
        List<Integer> annual = new ArrayList<>();
        for (int i = 0; i < amounts.size(); i++) {
            double value = amounts.get(i);
            if (thousands.get(i) || (anyKilo && value < 1000)) {
                value *= 1000;
            }
            long yearly = annualize(value, text);
            if (yearly > MAX_ANNUAL_SALARY) {
                return SalaryRange.NONE;
            }
            annual.add((int) yearly);
        }

        if (annual.size() == 1) {
            String lower = text.toLowerCase(Locale.ROOT);
            return lower.contains("up to") ? new SalaryRange(null, annual.get(0)) : new SalaryRange(annual.get(0), null);
        }
        int low = Math.min(annual.get(0), annual.get(1));
        int high = Math.max(annual.get(0), annual.get(1));
        return new SalaryRange(low, high);
    }

    private static long annualize(double value, String text) {
        if (HOURLY.matcher(text).find()) {
            return Math.round(value * HOURS_PER_YEAR);
        }
        if (MONTHLY.matcher(text).find()) {
            return Math.round(value * 12);
        }
        if (value < 1000) {
            return Math.round(value * HOURS_PER_YEAR);
        }
        return Math.round(value);
    }

    public static JobType parseJobType(String text) {
        if (text == null || text.isBlank()) {
            return JobType.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("full-time") || lower.contains("full time") || lower.contains("fulltime")) {
            return JobType.FULL_TIME;
        }
        if (lower.contains("part-time") || lower.contains("part time")) {
            return JobType.PART_TIME;
        }
        if (lower.contains("contract") || lower.contains("temporary") || lower.contains("freelance")) {
            return JobType.CONTRACT;
        }
        if (INTERNSHIP.matcher(lower).find()) {
            return JobType.INTERNSHIP;
        }
        return JobType.UNKNOWN;
    }

    public static RemoteType parseRemoteType(String text) {
        if (text == null || text.isBlank()) {
            return RemoteType.UNKNOWN;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains("hybrid")) {
            return RemoteType.HYBRID;
        }
        if (lower.contains("remote") && !lower.contains("not remote") && !lower.contains("no remote")) {
            return RemoteType.REMOTE;
        }
        if (lower.contains("on-site") || lower.contains("onsite") || lower.contains("on site")
                || lower.contains("in-office") || lower.contains("in office")) {
            return RemoteType.ONSITE;
        }
        return RemoteType.UNKNOWN;
    }

    /**
     * Vocabulary terms mentioned in the text, in vocabulary order.
     */
    public static Set<String> extractSkills(String text, Collection<String> vocabulary) {
        Set<String> skills = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return skills;
        }
        for (String term : vocabulary) {
            if (containsKeyword(text, term)) {
                skills.add(term.toLowerCase(Locale.ROOT));
            }
        }
        return skills;
    }

    /**
     * Case-insensitive, word-bounded match that also accepts a plural "s"/"es" ending, so
     * "agent" matches "AI agents" but not "agentic".
     */
    public static boolean containsKeyword(String text, String keyword) {
        if (text == null || keyword == null || keyword.isBlank()) {
            return false;
        }
        return KEYWORD_PATTERNS.computeIfAbsent(keyword.strip().toLowerCase(Locale.ROOT), key -> Pattern.compile(
                "(?<![\\p{Alnum}])" + Pattern.quote(key) + "(?:s|es)?(?![\\p{Alnum}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)).matcher(text).find();
    }

    /**
     * Collapse runs of whitespace and trim; {@code null} becomes "".
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    public static String resolveUrl(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return "";
        }
        String trimmed = href.strip();
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            return trimmed;
        }
        try {
            return URI.create(baseUrl).resolve(trimmed).toString();
        } catch (IllegalArgumentException e) {
            return trimmed;
        }
    }
}
