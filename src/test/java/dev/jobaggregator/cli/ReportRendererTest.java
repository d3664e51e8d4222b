package dev.jobaggregator.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.jobaggregator.cli.CliOptions.OutputFormat;
import dev.jobaggregator.config.QueriesConfig.Category;
import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.OutcomeStatus;
import dev.jobaggregator.model.SalaryStats;
import dev.jobaggregator.model.ScrapeOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReportRendererTest {

  private ObjectMapper objectMapper;
  private ReportRenderer renderer;
  private AggregatedResult result;

  @BeforeEach
  void setUp() {
    ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/");
    resolver.setSuffix(".txt");
    resolver.setTemplateMode(TemplateMode.TEXT);
    resolver.setCharacterEncoding("UTF-8");
    SpringTemplateEngine templateEngine = new SpringTemplateEngine();
    templateEngine.setTemplateResolver(resolver);

    objectMapper = JsonMapper.builder().findAndAddModules().build();
    renderer = new ReportRenderer(templateEngine, objectMapper);

    JobListing top = JobListing.builder()
        .title("Senior LLM Engineer")
        .company("Acme AI")
        .location("Houston, TX")
        .url("https://www.indeed.com/viewjob?jk=abc")
        .salaryMin(120000)
        .salaryMax(150000)
        .skill("python")
        .skill("rag")
        .source("indeed")
        .alternateSource("linkedin")
        .discoveredAt(Instant.parse("2026-01-15T10:00:00Z"))
        .build()
        .withQualityScore(0.876);
    JobListing second = JobListing.builder()
        .title("ML Engineer")
        .url("https://remoteok.com/remote-jobs/1")
        .source("remoteok")
        .build()
        .withQualityScore(0.7);

    Map<String, Integer> technologies = new LinkedHashMap<>();
    technologies.put("python", 1);
    technologies.put("rag", 1);

    result = new AggregatedResult(
        List.of(top, second), 12, 10, 1,
        List.of(
            new ScrapeOutcome("indeed", 1, "LLM engineer", List.of(top), 6, 5, OutcomeStatus.OK, null, Duration.ofSeconds(4)),
            new ScrapeOutcome("glassdoor", 5, "LLM engineer", List.of(), 0, 0, OutcomeStatus.BLOCKED,
                "HTTP 403 on page 1", Duration.ofSeconds(1)),
            new ScrapeOutcome("remoteok", 4, "LLM engineer", List.of(second), 6, 5, OutcomeStatus.OK, null, Duration.ofSeconds(2))),
        Duration.ofMillis(4200), technologies,
        new SalaryStats(120000, 150000, 135000.0, 135000, 1, 2), "indeed");
  }

  @Test
  void shouldRenderFullReport() {
    String report = renderer.render(result, "LLM engineer", OutputFormat.FULL);

    assertThat(report)
        .contains("Job search: LLM engineer")
        .contains("Listings: 2 | raw: 12 | filtered out: 10 | duplicates removed: 1 | 4.2s")
        .contains("Best source: indeed")
        .contains("Salary: $120,000 - $150,000, median $135,000, average $135,000 (1 of 2 listings, 50%)")
        .contains("Top technologies: python (1), rag (1)")
        .contains("glassdoor: BLOCKED, 0 accepted of 0 raw - HTTP 403 on page 1")
        .contains("1. Senior LLM Engineer")
        .contains("Company:  Acme AI")
        .contains("Salary:   $120,000 - $150,000")
        .contains("Score:    0.88 via indeed (also on linkedin)")
        .contains("Skills:   python, rag")
        .contains("URL:      https://www.indeed.com/viewjob?jk=abc")
        .contains("2. ML Engineer")
        .contains("Company:  -")
        .contains("Incomplete sources: glassdoor");
  }

  @Test
  void shouldRenderBriefReport() {
    String report = renderer.render(result, "LLM engineer", OutputFormat.BRIEF);

    assertThat(report)
        .startsWith("LLM engineer: 2 listings (12 raw, 10 filtered out)")
        .contains("1. Senior LLM Engineer @ Acme AI | Houston, TX | $120,000 - $150,000 | 0.88 | https://www.indeed.com/viewjob?jk=abc")
        .contains("2. ML Engineer @ - | - | - | 0.70 | https://remoteok.com/remote-jobs/1")
        .contains("Incomplete sources: glassdoor");
  }

  @Test
  void shouldRenderCountsOnly() {
    String report = renderer.render(result, "llm_engineering", OutputFormat.COUNT_ONLY);

    assertThat(report)
        .contains("Listings: 2")
        .contains("Raw: 12")
        .contains("Filtered out: 10")
        .contains("Duplicates removed: 1")
        .contains("indeed: OK 1/6")
        .contains("glassdoor: BLOCKED 0/0")
        .doesNotContain("Senior LLM Engineer");
  }

  @Test
  void shouldSayWhenNothingMatched() {
    AggregatedResult empty = new AggregatedResult(List.of(), 3, 3, 0, List.of(), Duration.ZERO, Map.of(),
        SalaryStats.empty(0), "none");

    String report = renderer.render(empty, "xyzzy", OutputFormat.FULL);

    assertThat(report)
        .contains("No listings matched.")
        .contains("Salary: no salary data")
        .doesNotContain("Incomplete sources");
  }

  @Test
  void shouldRenderJson() throws Exception {
    JsonNode json = objectMapper.readTree(renderer.render(result, "LLM engineer", OutputFormat.JSON));

    assertThat(json.get("query").asText()).isEqualTo("LLM engineer");
    JsonNode listing = json.get("result").get("listings").get(0);
    assertThat(listing.get("title").asText()).isEqualTo("Senior LLM Engineer");
    assertThat(listing.get("salaryMin").asInt()).isEqualTo(120000);
    assertThat(listing.get("alternateSources").get(0).asText()).isEqualTo("linkedin");
    assertThat(listing.has("identityKey")).isFalse();
    assertThat(json.get("result").get("totalRaw").asInt()).isEqualTo(12);
    assertThat(json.get("result").get("outcomes").get(1).get("status").asText()).isEqualTo("BLOCKED");
    assertThat(json.get("result").get("bestSource").asText()).isEqualTo("indeed");
  }

  @Test
  void shouldRenderCategories() {
    Category category = new Category();
    category.setName("llm_engineering");
    category.setDescription("LLM and prompt engineering roles");
    category.setQueries(List.of("LLM engineer", "prompt engineer"));

    String listing = renderer.renderCategories(List.of(category));

    assertThat(listing)
        .contains("Query categories")
        .contains("llm_engineering - LLM and prompt engineering roles")
        .contains("  * LLM engineer")
        .contains("  * prompt engineer");
  }

  @Test
  void shouldFormatSalaryRanges() {
    JobListing.JobListingBuilder base = JobListing.builder().title("t").url("https://x.com/1").source("s");

    assertThat(ReportRenderer.formatSalary(base.build())).isEqualTo("-");
    assertThat(ReportRenderer.formatSalary(base.salaryMin(100000).build())).isEqualTo("$100,000+");
    assertThat(ReportRenderer.formatSalary(base.salaryMin(null).salaryMax(180000).build())).isEqualTo("up to $180,000");
  }
}
