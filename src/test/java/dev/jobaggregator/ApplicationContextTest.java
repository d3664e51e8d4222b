package dev.jobaggregator;

import dev.jobaggregator.source.SourceRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private PipelineRunner pipelineRunner;

  @MockitoBean
  private ExitManager exitManager;

  @Autowired
  private SourceRegistry sourceRegistry;

  @Test
  void contextLoads() {
    assertThat(sourceRegistry.sourceIds()).containsExactly("indeed", "linkedin", "ziprecruiter", "remoteok", "glassdoor");
  }
}
