package dev.jobaggregator.source.impl;

import dev.jobaggregator.config.ScraperProperties;
import dev.jobaggregator.error.BlockedException;
import dev.jobaggregator.model.SearchQuery;
import dev.jobaggregator.ratelimit.RateLimiter;
import dev.jobaggregator.ratelimit.RatePolicy;
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

class GlassdoorSourceTest {

  private MockWebServer mockWebServer;
  private GlassdoorSource source;
  private RateLimiter.Session limiter;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    ScraperProperties scraper = SiteTestSupport.scraper();
    source = new GlassdoorSource(SiteTestSupport.sources(GlassdoorSource.SOURCE_ID, mockWebServer),
        SiteTestSupport.filter(), SiteTestSupport.browser(scraper), scraper);
    limiter = new RateLimiter().openSession(Map.of(GlassdoorSource.SOURCE_ID, RatePolicy.of(source.getConfig())));
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void shouldParseJobListingItems() throws InterruptedException {
    mockWebServer.enqueue(html(page("Machine Learning Engineer Jobs", """
        <ul>
          <li data-test="jobListing">
            <span data-test="employer-name">Delta Energy</span>
            <a data-test="job-title" href="/job-listing/ml-engineer-delta?jl=42">Machine Learning Engineer</a>
            <div data-test="emp-location">Houston, TX</div>
            <div data-test="detailSalary">$120K - $160K (Employer est.)</div>
            <div data-test="descSnippet">Deploy PyTorch models on AWS. Full-time, on-site.</div>
          </li>
        </ul>
        """)));

    SearchQuery query = SearchQuery.builder().text("machine learning engineer").location("Houston").build();

    StepVerifier.create(source.fetchRaw(query, 1, limiter))
        .assertNext(job -> {
          assertThat(job.getTitle()).isEqualTo("Machine Learning Engineer");
          assertThat(job.getCompany()).isEqualTo("Delta Energy");
          assertThat(job.getUrl()).isEqualTo(mockWebServer.url("/job-listing/ml-engineer-delta?jl=42").toString());
          assertThat(job.getSalaryMin()).isEqualTo(120000);
          assertThat(job.getSalaryMax()).isEqualTo(160000);
          assertThat(job.getSkills()).containsExactlyInAnyOrder("pytorch", "aws");
          assertThat(job.getSource()).isEqualTo("glassdoor");
        })
        .verifyComplete();

    assertThat(mockWebServer.takeRequest().getPath())
        .isEqualTo("/Job/jobs.htm?sc.keyword=machine+learning+engineer&locKeyword=Houston&fromAge=14");
  }

  @Test
  void shouldCompleteEmptyOnNoResultsPage() {
    mockWebServer.enqueue(html(page("Jobs", "<div data-test=\"no-results\">No jobs found</div>")));

    StepVerifier.create(source.fetchRaw(SearchQuery.builder().text("xyzzy").build(), 2, limiter))
        .verifyComplete();
  }

  @Test
  void shouldReportBlockedWhenPageHasNeitherCardsNorNoResultsMarker() {
    mockWebServer.enqueue(html(page("Glassdoor", "<div id=\"app\"></div>")));

    StepVerifier.create(source.fetchRaw(SearchQuery.builder().text("engineer").build(), 1, limiter))
        .expectError(BlockedException.class)
        .verify();
  }
}
