package dev.jobaggregator.service;

import dev.jobaggregator.model.JobListing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.ToIntFunction;
import java.util.regex.Pattern;

/**
 * Decides whether two listings describe the same posting and merges them.
 * <p>
 * Listings are the same posting when their normalized URLs match, or when normalized title,
 * normalized company and city all match. The relation is reflexive and symmetric.
 */
@Slf4j
@Service
public class Deduplicator {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");
    private static final Set<String> LEGAL_SUFFIXES = Set.of(
            "inc", "incorporated", "llc", "ltd", "limited", "corp", "corporation", "co", "company",
            "plc", "gmbh", "lp", "llp", "ag", "sa", "pbc");

    public boolean identify(JobListing a, JobListing b) {
        if (a.getIdentityKey().equals(b.getIdentityKey())) {
            return true;
        }
        String titleA = normalizeTitle(a.getTitle());
        String companyA = normalizeCompany(a.getCompany());
        if (titleA.isEmpty() || companyA.isEmpty()) {
            return false;
        }
        return titleA.equals(normalizeTitle(b.getTitle()))
                && companyA.equals(normalizeCompany(b.getCompany()))
                && normalizeCity(a.getLocation()).equals(normalizeCity(b.getLocation()));
    }

    /**
     * Merge with every source at equal priority.
     */
    public JobListing merge(JobListing a, JobListing b) {
        return merge(a, b, source -> 0);
    }

    /**
     * Merge two listings of the same posting. The preferred listing (higher score, then lower
     * source priority, then earlier discovery) keeps its identity and score; its gaps are
     * filled from the other and the other's sources are recorded as alternates.
     */
    public JobListing merge(JobListing a, JobListing b, ToIntFunction<String> priorityOf) {
        Comparator<JobListing> preference = preference(priorityOf);
        JobListing base = preference.compare(a, b) <= 0 ? a : b;
        JobListing other = base == a ? b : a;

        JobListing.JobListingBuilder merged = base.toBuilder();
        if (!base.isSalaryPresent() && other.isSalaryPresent()) {
            merged.salaryMin(other.getSalaryMin())
                    .salaryMax(other.getSalaryMax())
                    .salaryText(other.getSalaryText());
        }
        if (!base.isJobTypeKnown()) {
            merged.jobType(other.getJobType());
        }
        if (!base.isRemoteTypeKnown()) {
            merged.remoteType(other.getRemoteType());
        }
        if (base.getDescription().isBlank()) {
            merged.description(other.getDescription());
        }
        if (base.getLocation().isBlank()) {
            merged.location(other.getLocation());
        }
        if (base.getCompany().isBlank()) {
            merged.company(other.getCompany());
        }
        merged.skills(other.getSkills());

        Set<String> alternates = new LinkedHashSet<>(base.getAlternateSources());
        alternates.add(other.getSource());
        alternates.addAll(other.getAlternateSources());
        alternates.remove(base.getSource());
        merged.clearAlternateSources().alternateSources(alternates);

        log.debug("Merged '{}' from {} into {}", other.getTitle(), other.getSource(), base.getSource());
        return merged.build();
    }

    /**
     * Best listing first: score descending, source priority ascending, discovery order.
     */
    static Comparator<JobListing> preference(ToIntFunction<String> priorityOf) {
        return Comparator.comparingDouble(JobListing::getQualityScore).reversed()
                .thenComparingInt(listing -> priorityOf.applyAsInt(listing.getSource()))
                .thenComparingInt(JobListing::getDiscoveryIndex);
    }

    public static String normalizeTitle(String title) {
        return collapse(title);
    }

    /**
     * Lowercased company name without punctuation or trailing legal suffixes.
     */
    public static String normalizeCompany(String company) {
        String collapsed = collapse(company);
        if (collapsed.isEmpty()) {
            return collapsed;
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(collapsed.split(" ")));
        while (tokens.size() > 1 && LEGAL_SUFFIXES.contains(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
        }
        return String.join(" ", tokens);
    }

    /**
     * City part of a location: the text before the first comma, without parenthesized notes.
     */
    public static String normalizeCity(String location) {
        if (location == null) {
            return "";
        }
        String withoutNotes = PARENTHESIZED.matcher(location).replaceAll(" ");
        int comma = withoutNotes.indexOf(',');
        return collapse(comma >= 0 ? withoutNotes.substring(0, comma) : withoutNotes);
    }

    private static String collapse(String value) {
        if (value == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }
}
