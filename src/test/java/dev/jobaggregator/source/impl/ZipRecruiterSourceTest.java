package dev.jobaggregator.source.impl;

import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.error.NetworkException;
import dev.jobaggregator.error.PageParseException;
import dev.jobaggregator.model.JobType;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.ratelimit.RateLimiter;
import dev.jobaggregator.ratelimit.RatePolicy;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.Map;

import static dev.jobaggregator.source.impl.SiteTestSupport.html;
import static dev.jobaggregator.source.impl.SiteTestSupport.page;
import static org.assertj.core.api.Assertions.assertThat;

class ZipRecruiterSourceTest {

  private MockWebServer mockWebServer;
  private ZipRecruiterSource source;
  private RateLimiter.Session limiter;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    ScraperProperties scraper = SiteTestSupport.scraper();
    source = new ZipRecruiterSource(SiteTestSupport.sources(ZipRecruiterSource.SOURCE_ID, mockWebServer),
        SiteTestSupport.filter(), SiteTestSupport.browser(scraper), scraper);
    limiter = new RateLimiter().openSession(Map.of(ZipRecruiterSource.SOURCE_ID, RatePolicy.of(source.getConfig())));
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void shouldParseJobResultCards() throws InterruptedException {
    mockWebServer.enqueue(html(page("AI Engineer Jobs", """
        <article class="job_result">
          <h2 class="title"><a class="job_link" href="/c/Acme/Job/AI-Engineer?jid=1">AI Engineer</a></h2>
          <a class="company_name">Acme Robotics</a>
          <a class="company_location">Houston, TX</a>
          <p class="salary">$60 - $75 an hour</p>
          <p class="job_snippet">Contract role building RAG services in Python.</p>
        </article>
        """)));

    SearchQuery query = SearchQuery.builder().text("AI engineer").location("Houston, TX").build();

    StepVerifier.create(source.fetchRaw(query, 3, limiter))
        .assertNext(job -> {
          assertThat(job.getTitle()).isEqualTo("AI Engineer");
          assertThat(job.getCompany()).isEqualTo("Acme Robotics");
          assertThat(job.getLocation()).isEqualTo("Houston, TX");
          assertThat(job.getUrl()).isEqualTo(mockWebServer.url("/c/Acme/Job/AI-Engineer?jid=1").toString());
          assertThat(job.getSalaryMin()).isEqualTo(124800);
          assertThat(job.getSalaryMax()).isEqualTo(156000);
          assertThat(job.getSalaryText()).isEqualTo("$60 - $75 an hour");
          assertThat(job.getJobType()).isEqualTo(JobType.CONTRACT);
          assertThat(job.getSource()).isEqualTo("ziprecruiter");
        })
        .verifyComplete();

    assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    assertThat(mockWebServer.takeRequest().getPath())
        .isEqualTo("/jobs-search?search=AI+engineer&location=Houston%2C+TX&days=7");
  }

  @Test
  void shouldOmitLocationParameterWhenBlank() throws InterruptedException {
    mockWebServer.enqueue(html(page("Jobs", "<div class=\"zrs_no_results\">No jobs</div>")));

    StepVerifier.create(source.fetchRaw(SearchQuery.builder().text("ML engineer").build(), 1, limiter))
        .verifyComplete();

    assertThat(mockWebServer.takeRequest().getPath()).isEqualTo("/jobs-search?search=ML+engineer&days=7");
  }

  @Test
  void shouldRequestNumberedPagesWhileNextLinkIsPresent() throws InterruptedException {
    String card = """
        <article class="job_result">
          <h2 class="title"><a class="job_link" href="/job/%d">Engineer %d</a></h2>
        </article>
        """;
    mockWebServer.enqueue(html(page("Jobs", card.formatted(1, 1) + "<a rel=\"next\" href=\"?page=2\">Next</a>")));
    mockWebServer.enqueue(html(page("Jobs", card.formatted(2, 2))));

    StepVerifier.create(source.fetchRaw(SearchQuery.builder().text("engineer").build(), 5, limiter))
        .expectNextCount(2)
        .verifyComplete();

    mockWebServer.takeRequest();
    assertThat(mockWebServer.takeRequest().getPath()).endsWith("&page=2");
  }

  @Test
  void shouldFailParsingWhenMarkupChanged() {
    mockWebServer.enqueue(html(page("Jobs", """
        <article class="job_result"><div class="renamed">AI Engineer</div></article>
        """)));

    StepVerifier.create(source.fetchRaw(SearchQuery.builder().text("AI engineer").build(), 1, limiter))
        .expectError(PageParseException.class)
        .verify();
  }

  @Test
  void shouldReportServerErrorsAsNetworkFailures() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(502));

    StepVerifier.create(source.fetchRaw(SearchQuery.builder().text("AI engineer").build(), 1, limiter))
        .expectError(NetworkException.class)
        .verify();
  }
}
