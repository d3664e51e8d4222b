package dev.jobaggregator;

import dev.jobaggregator.cli.CliOptions;
import dev.jobaggregator.cli.ReportRenderer;
import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.error.ConfigurationException;
import dev.jobaggregator.model.AggregatedResult;
import dev.jobaggregator.service.JobSearchService;
import dev.jobaggregator.service.QueryCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.io.PrintStream;
/**
 * Turns the command line into a search, prints the report and maps the outcome to an exit
 * code. Separated from the main Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PipelineRunner {

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_CONFIGURATION = 2;

  private static final String SEPARATOR = "========================================";

  private final JobSearchService jobSearchService;
  private final QueryCatalog queryCatalog;
  private final ReportRenderer reportRenderer;
  private final ScraperProperties scraperProperties;

  private PrintStream out = System.out;

  /**
   * Executes the command line.
   *
   * @return 0 on a completed run (even with blocked sources), 2 on configuration errors,
   *         1 on any other failure
   */
  public int execute(String... args) {
    try {
      CliOptions options = CliOptions.parse(args);

      if (options.mode() == CliOptions.Mode.LIST_CATEGORIES) {
        out.print(reportRenderer.renderCategories(queryCatalog.categories()));
        return EXIT_OK;
      }

      log.info(SEPARATOR);
      log.info("Job Aggregator Starting ({} search)", options.mode());
      log.info(SEPARATOR);

      String label = label(options);
      AggregatedResult result = run(options, label).block();
      if (result == null) {
        throw new IllegalStateException("Search produced no result");
      }

      out.print(reportRenderer.render(result.limit(options.maxJobs()), label, options.format()));

      log.info(SEPARATOR);
      log.info("Job Aggregator Completed: {} listings, failed sources: {}",
          result.listings().size(), result.failedSources());
      log.info(SEPARATOR);
      return EXIT_OK;
    } catch (ConfigurationException e) {
      log.error("Configuration error: {}", e.getMessage());
      return EXIT_CONFIGURATION;
    } catch (Exception e) {
      log.error("Job Aggregator failed: {}", e.getMessage(), e);
      return EXIT_FAILURE;
    }
  }

  void setOut(PrintStream out) {
    this.out = out;
  }

  private Mono<AggregatedResult> run(CliOptions options, String label) {
    return switch (options.mode()) {
      case CATEGORY -> jobSearchService.searchCategory(options.category(), options.maxJobs(), options.toQuery(null));
      case COMPREHENSIVE -> jobSearchService.searchComprehensive(options.maxJobs(), options.toQuery(null));
      case MULTI -> jobSearchService.searchQueries(options.queries(), options.maxJobs(), options.toQuery(null));
      default -> jobSearchService.search(options.toQuery(label));
    };
  }

  private String label(CliOptions options) {
    return switch (options.mode()) {
      case RANDOM -> queryCatalog.randomQuery();
      case CATEGORY -> "category " + options.category();
      case COMPREHENSIVE -> "all categories";
      case MULTI -> String.join("; ", options.queries());
      default -> options.query() != null ? options.query() : scraperProperties.getDefaultQuery();
    };
  }
}
