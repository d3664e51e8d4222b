package dev.jobaggregator.service;

import dev.jobaggregator.config.FilterConfig;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.RemoteType;
import dev.jobaggregator.model.SourceConfig;
import dev.jobaggregator.source.ListingTextParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Accepts or rejects a single listing against its source's configuration.
 * <p>
 * Checks run in order and the first failing one decides: exclude keywords, excluded
 * companies, excluded experience levels, allowed job and remote types, required keywords,
 * salary bounds, then the quality score threshold. The decision depends only on the listing,
 * the source configuration and the mode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityFilter {

    private final FilterConfig filterConfig;

    /**
     * Result of evaluating one listing.
     */
    public record FilterDecision(boolean accepted, double score, String reason) {

        public static FilterDecision rejected(String reason) {
            return new FilterDecision(false, 0.0, reason);
        }
    }

    public boolean accept(JobListing listing, SourceConfig config, boolean strict) {
        return evaluate(listing, config, strict).accepted();
    }

    public FilterDecision evaluate(JobListing listing, SourceConfig config, boolean strict) {
        String title = listing.getTitle();
        String description = listing.getDescription();
        String everything = String.join(" ", title, listing.getCompany(), description,
                String.join(" ", listing.getSkills()));

        for (String excluded : config.excludeKeywords()) {
            if (ListingTextParser.containsKeyword(everything, excluded)) {
                return reject(listing, "Excluded keyword: " + excluded);
            }
        }

        String company = normalizeCompany(listing.getCompany());
        if (!company.isEmpty()) {
            for (String excludedCompany : config.excludeCompanies()) {
                if (company.equals(normalizeCompany(excludedCompany))) {
                    return reject(listing, "Excluded company: " + listing.getCompany());
                }
            }
        }

        for (String level : config.excludedExperienceLevelsFor(strict)) {
            if (ListingTextParser.containsKeyword(title, level)) {
                return reject(listing, "Excluded experience level: " + level);
            }
        }

        if (!config.allowedJobTypes().isEmpty() && !config.allowedJobTypes().contains(listing.getJobType())) {
            return reject(listing, "Job type " + listing.getJobType() + " not allowed");
        }
        List<RemoteType> remoteTypes = config.allowedRemoteTypesFor(strict);
        if (!remoteTypes.isEmpty() && !remoteTypes.contains(listing.getRemoteType())) {
            return reject(listing, "Remote type " + listing.getRemoteType() + " not allowed");
        }

        if (!config.requiredKeywords().isEmpty()) {
            String searchable = title + " " + description;
            boolean found = config.requiredKeywords().stream()
                    .anyMatch(keyword -> ListingTextParser.containsKeyword(searchable, keyword));
            if (!found) {
                return reject(listing, "No required keyword");
            }
        }

        if (listing.isSalaryPresent()) {
            Integer minSalary = config.minSalaryFor(strict);
            if (minSalary != null && listing.getSalaryFloor() < minSalary) {
                return reject(listing, "Salary " + listing.getSalaryFloor() + " below minimum " + minSalary);
            }
            Integer maxSalary = config.maxSalaryFor(strict);
            if (maxSalary != null && listing.getSalaryCeiling() > maxSalary) {
                return reject(listing, "Salary " + listing.getSalaryCeiling() + " above maximum " + maxSalary);
            }
        }

        double score = score(listing, config);
        double threshold = config.thresholdFor(strict);
        if (score < threshold) {
            log.debug("{} - '{}' scored {} below {}", listing.getSource(), title, score, threshold);
            return new FilterDecision(false, score, String.format(Locale.ROOT, "Score %.2f below %.2f", score, threshold));
        }
        return new FilterDecision(true, score, null);
    }

    /**
     * Weighted completeness score in [0,1].
     */
    public double score(JobListing listing, SourceConfig config) {
        FilterConfig.Weights weights = filterConfig.getWeights();

        double score = 0.0;
        int descriptionCap = Math.max(1, weights.getDescriptionCap());
        score += weights.getDescription() * Math.min(listing.getDescriptionLength(), descriptionCap) / descriptionCap;
        if (listing.isSalaryPresent()) {
            score += weights.getSalary();
        }
        if (listing.isJobTypeKnown()) {
            score += weights.getJobType();
        }
        if (listing.isRemoteTypeKnown()) {
            score += weights.getRemoteType();
        }
        int technologyCap = Math.max(1, weights.getTechnologyCap());
        int technologies = recognizedTechnologies(listing, config).size();
        score += weights.getTechnology() * Math.min(technologies, technologyCap) / technologyCap;

        return Math.min(1.0, Math.round(score * 10_000) / 10_000.0);
    }

    Set<String> recognizedTechnologies(JobListing listing, SourceConfig config) {
        String text = listing.getTitle() + " " + listing.getDescription();
        Set<String> found = new LinkedHashSet<>();
        for (String term : config.techKeywords()) {
            String normalized = term.toLowerCase(Locale.ROOT);
            if (listing.getSkills().contains(normalized) || ListingTextParser.containsKeyword(text, term)) {
                found.add(normalized);
            }
        }
        return found;
    }

    private FilterDecision reject(JobListing listing, String reason) {
        log.debug("{} - '{}' rejected: {}", listing.getSource(), listing.getTitle(), reason);
        return FilterDecision.rejected(reason);
    }

    static String normalizeCompany(String company) {
        return Deduplicator.normalizeCompany(company);
    }
}
