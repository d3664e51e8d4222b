package dev.jobaggregator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.jobaggregator.util.UrlNormalizer;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Set;

/**
 * A normalized job posting produced by a source adapter.
 * <p>
 * Instances are immutable. The quality score, discovery index and alternate sources are
 * assigned later in the pipeline by creating modified copies. Two listings are equal when
 * their normalized posting URLs are equal.
 */
@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JobListing {

    @NonNull
    String title;

    @Builder.Default
    String company = "";

    @Builder.Default
    String location = "";

    @Builder.Default
    String description = "";

    @NonNull
    String url;

    // USD per year
    Integer salaryMin;
    Integer salaryMax;
    String salaryText;

    @Builder.Default
    JobType jobType = JobType.UNKNOWN;

    @Builder.Default
    RemoteType remoteType = RemoteType.UNKNOWN;

    @NonNull
    String source;

    @Singular
    Set<String> skills;

    Instant discoveredAt;

    @With
    double qualityScore;

    @With
    int discoveryIndex;

    @Singular
    Set<String> alternateSources;

    @JsonIgnore
    @EqualsAndHashCode.Include
    public String getIdentityKey() {
        return UrlNormalizer.normalize(url);
    }

    public boolean isSalaryPresent() {
        return salaryMin != null || salaryMax != null;
    }

    public boolean isJobTypeKnown() {
        return jobType != JobType.UNKNOWN;
    }

    public boolean isRemoteTypeKnown() {
        return remoteType != RemoteType.UNKNOWN;
    }

    public int getDescriptionLength() {
        return description == null ? 0 : description.strip().length();
    }

    /**
     * Lower bound of the salary range, falling back to the upper bound.
     */
    @JsonIgnore
    public Integer getSalaryFloor() {
        return salaryMin != null ? salaryMin : salaryMax;
    }

    /**
     * Upper bound of the salary range, falling back to the lower bound.
     */
    @JsonIgnore
    public Integer getSalaryCeiling() {
        return salaryMax != null ? salaryMax : salaryMin;
    }
}
