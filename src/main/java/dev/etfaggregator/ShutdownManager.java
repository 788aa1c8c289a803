package dev.etfaggregator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the application context and ends the JVM after a one-shot run.
 * Never calls System.exit under a test runner.
 */
@Slf4j
@Component
public class ShutdownManager {

  private final ConfigurableApplicationContext context;

  public ShutdownManager(ConfigurableApplicationContext context) {
    this.context = context;
  }

  public void exit(int status) {
    int code = SpringApplication.exit(context, () -> status);
    if (isTest()) {
      log.debug("Exit code {} not propagated under test", code);
      return;
    }
    System.exit(code);
  }

  protected boolean isTest() {
    String cp = System.getProperty("java.class.path", "");
    return cp.contains("junit") || cp.contains("surefire") || cp.contains("intellij");
  }
}
