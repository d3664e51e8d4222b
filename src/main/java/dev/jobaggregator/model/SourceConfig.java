package dev.jobaggregator.model;

import dev.jobaggregator.error.ConfigurationException;
import lombok.Builder;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable per-source settings, fixed for the lifetime of the orchestrator.
 */
@Builder(toBuilder = true)
public record SourceConfig(
        String sourceId,
        boolean enabled,
        int priority,
        int maxPages,
        Duration minDelay,
        Duration maxDelay,
        int maxRequests,
        Integer minSalary,
        Integer maxSalary,
        Integer strictMinSalary,
        Integer strictMaxSalary,
        double minQualityScore,
        double strictMinQualityScore,
        List<String> requiredKeywords,
        List<String> excludeKeywords,
        List<String> excludeCompanies,
        List<String> techKeywords,
        List<JobType> allowedJobTypes,
        List<RemoteType> allowedRemoteTypes,
        List<RemoteType> strictAllowedRemoteTypes,
        List<String> excludeExperienceLevels,
        List<String> strictExcludeExperienceLevels,
        String baseUrl) {

    public SourceConfig {
        minDelay = minDelay == null ? Duration.ZERO : minDelay;
        maxDelay = maxDelay == null ? minDelay : maxDelay;
        requiredKeywords = requiredKeywords == null ? List.of() : List.copyOf(requiredKeywords);
        excludeKeywords = excludeKeywords == null ? List.of() : List.copyOf(excludeKeywords);
        excludeCompanies = excludeCompanies == null ? List.of() : List.copyOf(excludeCompanies);
        techKeywords = techKeywords == null ? List.of() : List.copyOf(techKeywords);
        allowedJobTypes = allowedJobTypes == null ? List.of() : List.copyOf(allowedJobTypes);
        allowedRemoteTypes = allowedRemoteTypes == null ? List.of() : List.copyOf(allowedRemoteTypes);
        strictAllowedRemoteTypes = strictAllowedRemoteTypes == null ? List.of() : List.copyOf(strictAllowedRemoteTypes);
        excludeExperienceLevels = excludeExperienceLevels == null ? List.of() : List.copyOf(excludeExperienceLevels);
        strictExcludeExperienceLevels = strictExcludeExperienceLevels == null
                ? List.of() : List.copyOf(strictExcludeExperienceLevels);
    }

    public Integer minSalaryFor(boolean strict) {
        return strict && strictMinSalary != null ? strictMinSalary : minSalary;
    }

    public Integer maxSalaryFor(boolean strict) {
        return strict && strictMaxSalary != null ? strictMaxSalary : maxSalary;
    }

    /**
     * Remote types a listing may have; empty allows every type.
     */
    public List<RemoteType> allowedRemoteTypesFor(boolean strict) {
        return strict && !strictAllowedRemoteTypes.isEmpty() ? strictAllowedRemoteTypes : allowedRemoteTypes;
    }

    /**
     * Seniority terms that reject a listing by title. Strict mode adds its own terms to the general ones.
     */
    public List<String> excludedExperienceLevelsFor(boolean strict) {
        if (!strict || strictExcludeExperienceLevels.isEmpty()) {
            return excludeExperienceLevels;
        }
        Set<String> levels = new LinkedHashSet<>(excludeExperienceLevels);
        levels.addAll(strictExcludeExperienceLevels);
        return List.copyOf(levels);
    }

    public double thresholdFor(boolean strict) {
        return strict ? strictMinQualityScore : minQualityScore;
    }

    /**
     * Rejects settings no run could honour.
     *
     * @throws ConfigurationException when a bound pair is inverted or a value is out of range
     */
    public SourceConfig validate() {
        if (sourceId == null || sourceId.isBlank()) {
            throw new ConfigurationException("Source id must not be blank");
        }
        if (minDelay.isNegative() || minDelay.compareTo(maxDelay) > 0) {
            throw new ConfigurationException("Invalid delay bounds for " + sourceId + ": " + minDelay + " > " + maxDelay);
        }
        if (maxRequests < 1) {
            throw new ConfigurationException("Max requests for " + sourceId + " must be at least 1");
        }
        if (maxPages < 1) {
            throw new ConfigurationException("Max pages for " + sourceId + " must be at least 1");
        }
        checkSalaryBounds(minSalaryFor(false), maxSalaryFor(false));
        checkSalaryBounds(minSalaryFor(true), maxSalaryFor(true));
        checkThreshold(minQualityScore);
        checkThreshold(strictMinQualityScore);
        return this;
    }

    private void checkSalaryBounds(Integer floor, Integer ceiling) {
        if (floor != null && floor < 0) {
            throw new ConfigurationException("Negative salary floor for " + sourceId);
        }
        if (floor != null && ceiling != null && floor > ceiling) {
            throw new ConfigurationException(
                    "Invalid salary bounds for " + sourceId + ": " + floor + " > " + ceiling);
        }
    }

    private void checkThreshold(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new ConfigurationException("Quality threshold for " + sourceId + " must be within [0,1]");
        }
    }
}
