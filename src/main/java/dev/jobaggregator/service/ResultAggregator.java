package dev.jobaggregator.service;

import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.SalaryStats;
import dev.jobaggregator.model.ScrapeOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToIntFunction;

/**
 * Merges per-source outcomes into one deduplicated, ranked result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResultAggregator {

    static final String NO_SOURCE = "none";

    private final Deduplicator deduplicator;

    public AggregatedResult aggregate(List<ScrapeOutcome> outcomes, Duration duration) {
        ToIntFunction<String> priorityOf = priorities(outcomes);
        List<JobListing> accepted = outcomes.stream()
                .flatMap(outcome -> outcome.listings().stream())
                .toList();

        List<JobListing> ranked = deduplicate(accepted, priorityOf);
        int duplicates = accepted.size() - ranked.size();
        int totalRaw = outcomes.stream().mapToInt(ScrapeOutcome::rawCount).sum();
        int qualityRejected = outcomes.stream().mapToInt(ScrapeOutcome::filteredCount).sum();

        log.info("Aggregated {} accepted listings into {} ({} duplicates removed)",
                accepted.size(), ranked.size(), duplicates);

        return new AggregatedResult(ranked, totalRaw, qualityRejected + duplicates, duplicates, outcomes, duration,
                technologyBreakdown(ranked), salaryStats(ranked), bestSource(outcomes));
    }

    /**
     * Combine results of several searches, deduplicating across them. Outcomes are
     * concatenated in input order.
     */
    public AggregatedResult combine(List<AggregatedResult> results, Duration duration) {
        List<ScrapeOutcome> outcomes = results.stream()
                .flatMap(result -> result.outcomes().stream())
                .toList();
        ToIntFunction<String> priorityOf = priorities(outcomes);
        List<JobListing> listings = results.stream()
                .flatMap(result -> result.listings().stream())
                .toList();

        List<JobListing> ranked = deduplicate(listings, priorityOf);
        int crossDuplicates = listings.size() - ranked.size();
        int totalRaw = results.stream().mapToInt(AggregatedResult::totalRaw).sum();
        int totalFiltered = results.stream().mapToInt(AggregatedResult::totalFiltered).sum() + crossDuplicates;
        int duplicates = results.stream().mapToInt(AggregatedResult::duplicatesRemoved).sum() + crossDuplicates;

        log.info("Combined {} searches into {} listings ({} cross-search duplicates)",
                results.size(), ranked.size(), crossDuplicates);

        return new AggregatedResult(ranked, totalRaw, totalFiltered, duplicates, outcomes, duration,
                technologyBreakdown(ranked), salaryStats(ranked), bestSource(outcomes));
    }

    /**
     * Exact merge by normalized URL, then the title/company/city heuristic within groups that
     * share the first company token. Returns the survivors ranked.
     */
    List<JobListing> deduplicate(Collection<JobListing> listings, ToIntFunction<String> priorityOf) {
        Comparator<JobListing> ranking = ranking(priorityOf);
        List<JobListing> working = new ArrayList<>(listings);
        working.sort(ranking);

        Map<String, JobListing> byUrl = new LinkedHashMap<>();
        for (JobListing listing : working) {
            byUrl.merge(listing.getIdentityKey(), listing, (kept, incoming) -> deduplicator.merge(kept, incoming, priorityOf));
        }

        Map<String, List<JobListing>> byCompanyToken = new LinkedHashMap<>();
        List<JobListing> survivors = new ArrayList<>();
        for (JobListing listing : byUrl.values()) {
            String token = firstToken(Deduplicator.normalizeCompany(listing.getCompany()));
            if (token.isEmpty()) {
                survivors.add(listing);
                continue;
            }
            List<JobListing> group = byCompanyToken.computeIfAbsent(token, key -> new ArrayList<>());
            mergeIntoGroup(group, listing, priorityOf);
        }
        byCompanyToken.values().forEach(survivors::addAll);

        survivors.sort(ranking);
        return survivors;
    }

    private void mergeIntoGroup(List<JobListing> group, JobListing listing, ToIntFunction<String> priorityOf) {
        for (int i = 0; i < group.size(); i++) {
            if (deduplicator.identify(group.get(i), listing)) {
                group.set(i, deduplicator.merge(group.get(i), listing, priorityOf));
                return;
            }
        }
        group.add(listing);
    }

    /**
     * Score descending, source priority ascending, discovery index ascending, then source id
     * and normalized URL so that equal listings always land in the same order.
     */
    static Comparator<JobListing> ranking(ToIntFunction<String> priorityOf) {
        return Deduplicator.preference(priorityOf)
                .thenComparing(JobListing::getSource)
                .thenComparing(JobListing::getIdentityKey);
    }

    Map<String, Integer> technologyBreakdown(List<JobListing> listings) {
        Map<String, Integer> counts = new TreeMap<>();
        for (JobListing listing : listings) {
            listing.getSkills().forEach(skill -> counts.merge(skill, 1, Integer::sum));
        }
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return sorted;
    }

    SalaryStats salaryStats(List<JobListing> listings) {
        List<JobListing> withSalary = listings.stream().filter(JobListing::isSalaryPresent).toList();
        if (withSalary.isEmpty()) {
            return SalaryStats.empty(listings.size());
        }
        int min = withSalary.stream().mapToInt(JobListing::getSalaryFloor).min().orElseThrow();
        int max = withSalary.stream().mapToInt(JobListing::getSalaryCeiling).max().orElseThrow();
        int[] midpoints = withSalary.stream()
                .mapToInt(listing -> (listing.getSalaryFloor() + listing.getSalaryCeiling()) / 2)
                .sorted()
                .toArray();
        double average = Math.round(Arrays.stream(midpoints).average().orElse(0.0));
        int middle = midpoints.length / 2;
        int median = midpoints.length % 2 == 1 ? midpoints[middle] : (midpoints[middle - 1] + midpoints[middle]) / 2;
        return new SalaryStats(min, max, average, median, withSalary.size(), listings.size());
    }

    /**
     * Source with the largest accepted volume weighted by average score; ties go to the
     * preferred source.
     */
    String bestSource(List<ScrapeOutcome> outcomes) {
        Map<String, double[]> totals = new LinkedHashMap<>();
        Map<String, Integer> priorities = new HashMap<>();
        for (ScrapeOutcome outcome : outcomes) {
            double[] total = totals.computeIfAbsent(outcome.sourceId(), key -> new double[1]);
            total[0] += outcome.acceptedCount() * outcome.averageScore();
            priorities.putIfAbsent(outcome.sourceId(), outcome.priority());
        }
        return totals.entrySet().stream()
                .filter(entry -> entry.getValue()[0] > 0)
                .min(Comparator.<Map.Entry<String, double[]>>comparingDouble(entry -> -entry.getValue()[0])
                        .thenComparingInt(entry -> priorities.get(entry.getKey()))
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .orElse(NO_SOURCE);
    }

    private static ToIntFunction<String> priorities(List<ScrapeOutcome> outcomes) {
        Map<String, Integer> priorities = new HashMap<>();
        outcomes.forEach(outcome -> priorities.merge(outcome.sourceId(), outcome.priority(), Math::min));
        return source -> priorities.getOrDefault(source, Integer.MAX_VALUE);
    }

    private static String firstToken(String normalizedCompany) {
        int space = normalizedCompany.indexOf(' ');
        return space < 0 ? normalizedCompany : normalizedCompany.substring(0, space);
    }
}
