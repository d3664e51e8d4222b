package dev.jobaggregator.config;

import dev.jobaggregator.model.JobType;
import dev.jobaggregator.model.RemoteType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared filtering vocabulary, listing constraints and score weights. Per-source keyword lists
 * and salary caps under 'sources' override the values here when set. Empty type lists allow
 * every type.
 * Loaded from application.yml under 'filter' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "filter")
public class FilterConfig {

    private List<String> requiredKeywords = new ArrayList<>();
    private List<String> excludeKeywords = new ArrayList<>();
    private List<String> excludeCompanies = new ArrayList<>();
    private List<String> techKeywords = new ArrayList<>();
    private Integer maxSalary;
    private Integer strictMaxSalary;
    private List<JobType> allowedJobTypes = new ArrayList<>();
    private List<RemoteType> allowedRemoteTypes = new ArrayList<>();
    private List<RemoteType> strictAllowedRemoteTypes = new ArrayList<>();
    private List<String> excludeExperienceLevels = new ArrayList<>();
    private List<String> strictExcludeExperienceLevels = new ArrayList<>();
    private Weights weights = new Weights();

    @Data
    public static class Weights {
        private double description = 0.35;
        private int descriptionCap = 800;
        private double salary = 0.15;
        private double jobType = 0.10;
        private double remoteType = 0.10;
        private double technology = 0.30;
        private int technologyCap = 5;
    }
}
