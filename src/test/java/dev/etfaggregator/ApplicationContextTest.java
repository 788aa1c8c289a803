package dev.etfaggregator;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean
  private UpdateRunner updateRunner;

  @MockitoBean
  private ShutdownManager shutdownManager;

  @Test
  void contextLoads() {
  }
}
