package dev.jobaggregator;

import dev.jobaggregator.cli.CliOptions.OutputFormat;
import dev.jobaggregator.cli.ReportRenderer;
import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.error.ConfigurationException;
import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.model.JobListing;
import dev.jobaggregator.model.SalaryStats;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.service.JobSearchService;
import dev.jobaggregator.service.QueryCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineRunnerTest {

  @Mock
  private JobSearchService jobSearchService;

  @Mock
  private QueryCatalog queryCatalog;

  @Mock
  private ReportRenderer reportRenderer;

  private ByteArrayOutputStream output;
  private PipelineRunner pipelineRunner;

  @BeforeEach
  void setUp() {
    ScraperProperties properties = new ScraperProperties();
    properties.setDefaultQuery("LLM engineer");
    pipelineRunner = new PipelineRunner(jobSearchService, queryCatalog, reportRenderer, properties);
    output = new ByteArrayOutputStream();
    pipelineRunner.setOut(new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  private static AggregatedResult result(int listings) {
    List<JobListing> ranked = new ArrayList<>();
    for (int i = 0; i < listings; i++) {
      ranked.add(JobListing.builder().title("Job " + i).url("https://example.com/" + i).source("indeed").build());
    }
    return new AggregatedResult(ranked, listings, 0, 0, List.of(), Duration.ZERO, Map.of(),
        SalaryStats.empty(listings), "indeed");
  }

  @Test
  void execute_singleSearch_printsReportAndReturnsZero() {
    when(jobSearchService.search(any())).thenReturn(Mono.just(result(3)));
    when(reportRenderer.render(any(), eq("AI engineer"), eq(OutputFormat.BRIEF))).thenReturn("report\n");

    int status = pipelineRunner.execute("AI", "engineer", "--sources=indeed", "--brief");

    assertEquals(PipelineRunner.EXIT_OK, status);
    assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo("report\n");
    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(jobSearchService).search(captor.capture());
    assertThat(captor.getValue().text()).isEqualTo("AI engineer");
    assertThat(captor.getValue().enabledSources()).isEqualTo(Set.of("indeed"));
  }

  @Test
  void execute_noQuery_usesDefaultQueryAsLabel() {
    when(jobSearchService.search(any())).thenReturn(Mono.just(result(0)));
    when(reportRenderer.render(any(), eq("LLM engineer"), eq(OutputFormat.FULL))).thenReturn("");

    assertEquals(PipelineRunner.EXIT_OK, pipelineRunner.execute());
  }

  @Test
  void execute_limitsPrintedListingsToMaxJobs() {
    when(jobSearchService.search(any())).thenReturn(Mono.just(result(10)));
    when(reportRenderer.render(any(), any(), any())).thenReturn("");

    pipelineRunner.execute("--query=LLM engineer", "--max-jobs=4");

    ArgumentCaptor<AggregatedResult> captor = ArgumentCaptor.forClass(AggregatedResult.class);
    verify(reportRenderer).render(captor.capture(), eq("LLM engineer"), eq(OutputFormat.FULL));
    assertThat(captor.getValue().listings()).hasSize(4);
    assertThat(captor.getValue().totalRaw()).isEqualTo(10);
  }

  @Test
  void execute_randomMode_searchesCatalogQuery() {
    when(queryCatalog.randomQuery()).thenReturn("prompt engineer");
    when(jobSearchService.search(any())).thenReturn(Mono.just(result(1)));
    when(reportRenderer.render(any(), eq("prompt engineer"), any())).thenReturn("");

    assertEquals(PipelineRunner.EXIT_OK, pipelineRunner.execute("--random"));

    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(jobSearchService).search(captor.capture());
    assertThat(captor.getValue().text()).isEqualTo("prompt engineer");
  }

  @Test
  void execute_categoryMode_usesMaxJobsPerQuery() {
    when(jobSearchService.searchCategory(eq("llm_engineering"), eq(5), any())).thenReturn(Mono.just(result(2)));
    when(reportRenderer.render(any(), eq("category llm_engineering"), eq(OutputFormat.COUNT_ONLY))).thenReturn("");

    assertEquals(PipelineRunner.EXIT_OK,
        pipelineRunner.execute("--category=llm_engineering", "--max-jobs=5", "--count-only"));
  }

  @Test
  void execute_multiQueryMode_runsEveryQuery() {
    when(jobSearchService.searchQueries(eq(List.of("LLM engineer", "RAG engineer")), anyInt(), any()))
        .thenReturn(Mono.just(result(2)));
    when(reportRenderer.render(any(), eq("LLM engineer; RAG engineer"), any())).thenReturn("");

    assertEquals(PipelineRunner.EXIT_OK, pipelineRunner.execute("--queries=LLM engineer;RAG engineer"));
  }

  @Test
  void execute_comprehensiveMode_searchesAllCategories() {
    when(jobSearchService.searchComprehensive(anyInt(), any())).thenReturn(Mono.just(result(2)));
    when(reportRenderer.render(any(), eq("all categories"), any())).thenReturn("");

    assertEquals(PipelineRunner.EXIT_OK, pipelineRunner.execute("--comprehensive"));
  }

  @Test
  void execute_listCategories_printsWithoutSearching() {
    when(queryCatalog.categories()).thenReturn(List.of());
    when(reportRenderer.renderCategories(List.of())).thenReturn("categories\n");

    assertEquals(PipelineRunner.EXIT_OK, pipelineRunner.execute("--list-categories"));

    assertThat(output.toString(StandardCharsets.UTF_8)).isEqualTo("categories\n");
    verifyNoInteractions(jobSearchService);
  }

  @Test
  void execute_invalidArguments_returnsConfigurationExit() {
    assertEquals(PipelineRunner.EXIT_CONFIGURATION, pipelineRunner.execute("--max-jobs=zero"));
    verifyNoInteractions(jobSearchService);
  }

  @Test
  void execute_configurationErrorDuringSearch_returnsConfigurationExit() {
    when(jobSearchService.search(any())).thenReturn(Mono.error(new ConfigurationException("Unknown source(s): monster")));

    assertEquals(PipelineRunner.EXIT_CONFIGURATION, pipelineRunner.execute("--sources=monster"));
  }

  @Test
  void execute_unexpectedFailure_returnsFailureExit() {
    when(jobSearchService.search(any())).thenReturn(Mono.error(new IllegalStateException("boom")));

    assertEquals(PipelineRunner.EXIT_FAILURE, pipelineRunner.execute("LLM"));
  }
}
