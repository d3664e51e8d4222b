package dev.jobaggregator.browser;

import dev.jobaggregator.config.ScraperProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupBrowserAutomationTest {

  private MockWebServer mockWebServer;
  private JsoupBrowserAutomation browser;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    ScraperProperties properties = new ScraperProperties();
    properties.setMaxBrowserContexts(2);
    properties.setRequestTimeout(Duration.ofSeconds(5));
    browser = new JsoupBrowserAutomation(WebClient.builder(), properties);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void shouldLoadAndQueryPage() {
    mockWebServer.enqueue(new MockResponse()
        .setBody("""
            <html><head><title>Search results</title></head><body>
              <div class="card"><a href="/job/1">First</a><span class="pay">$100k</span></div>
              <div class="card"><a href="/job/2">Second</a></div>
            </body></html>
            """)
        .addHeader("Content-Type", "text/html"));

    try (BrowserSession session = browser.openSession("test")) {
      assertThat(session.navigate(mockWebServer.url("/search?q=llm").toString())).isTrue();
      assertThat(session.statusCode()).isEqualTo(200);
      assertThat(session.title()).isEqualTo("Search results");
      assertThat(session.exists("div.card")).isTrue();
      assertThat(session.exists("div.missing")).isFalse();
      assertThat(session.extractText("span.pay")).contains("$100k");
      assertThat(session.extractAttribute("div.card a", "abs:href"))
          .contains(mockWebServer.url("/job/1").toString());

      List<PageElement> cards = session.selectAll("div.card");
      assertThat(cards).hasSize(2);
      assertThat(cards.get(1).extractText("a")).contains("Second");
      assertThat(cards.get(1).extractText("span.pay")).isEmpty();
      assertThat(cards.get(0).text()).contains("First", "$100k");
    }
  }

  @Test
  void shouldReportClientErrorStatusWithoutFailingNavigation() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(403).setBody("<html><title>Access Denied</title></html>"));

    try (BrowserSession session = browser.openSession("test")) {
      assertThat(session.navigate(mockWebServer.url("/").toString())).isTrue();
      assertThat(session.statusCode()).isEqualTo(403);
      assertThat(session.title()).isEqualTo("Access Denied");
    }
  }

  @Test
  void shouldFailNavigationOnServerError() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));

    try (BrowserSession session = browser.openSession("test")) {
      assertThat(session.navigate(mockWebServer.url("/").toString())).isFalse();
      assertThat(session.statusCode()).isEqualTo(503);
    }
  }

  @Test
  void shouldFailNavigationWhenHostIsUnreachable() throws IOException {
    String url = mockWebServer.url("/").toString();
    mockWebServer.shutdown();

    try (BrowserSession session = browser.openSession("test")) {
      assertThat(session.navigate(url)).isFalse();
      assertThat(session.statusCode()).isZero();
      assertThat(session.selectAll("div")).isEmpty();
      assertThat(session.title()).isEmpty();
    }
  }

  @Test
  void shouldBoundOpenSessionsAndReleaseOnClose() {
    BrowserSession first = browser.openSession("a");
    BrowserSession second = browser.openSession("b");
    assertThat(browser.availableContexts()).isZero();

    first.close();
    first.close();
    assertThat(browser.availableContexts()).isEqualTo(1);

    second.close();
    assertThat(browser.availableContexts()).isEqualTo(2);
  }

  @Test
  void shouldRejectNavigationAfterClose() {
    BrowserSession session = browser.openSession("test");
    session.close();

    assertThatThrownBy(() -> session.navigate(mockWebServer.url("/").toString()))
        .isInstanceOf(IllegalStateException.class);
  }
}
