package dev.etfaggregator;

import dev.etfaggregator.config.AggregatorProperties;
import dev.etfaggregator.config.SourcesConfig;
import dev.etfaggregator.scheduler.UpdateScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneId;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EtfAggregatorApplicationTests {

  @Mock
  private UpdateRunner updateRunner;

  @Mock
  private UpdateScheduler updateScheduler;

  @Mock
  private ShutdownManager shutdownManager;

  private AggregatorProperties properties;
  private SourcesConfig sourcesConfig;
  private EtfAggregatorApplication app;

  @BeforeEach
  void setUp() {
    properties = new AggregatorProperties();
    sourcesConfig = new SourcesConfig();
    app = new EtfAggregatorApplication(properties, sourcesConfig, updateRunner, updateScheduler, shutdownManager);
  }

  @Test
  void shouldStartDailySchedulerInServiceMode() {
    app.run();

    verify(updateScheduler).start(18, 0, ZoneId.of("America/New_York"));
    verifyNoInteractions(updateRunner, shutdownManager);
  }

  @Test
  void shouldNotScheduleWhenDisabled() {
    properties.getScheduler().setEnabled(false);

    app.run();

    verify(updateScheduler, never()).start(anyInt(), anyInt(), any());
  }

  @Test
  void shouldRunOnceAndExitSuccessfully() {
    properties.setRunOnce(true);

    app.run();

    verify(updateRunner).execute(false);
    verify(shutdownManager).exit(0);
    verifyNoInteractions(updateScheduler);
  }

  @Test
  void shouldHonourForceFlag() {
    properties.setRunOnce(true);

    app.run("--force");

    verify(updateRunner).execute(true);
  }

  @Test
  void shouldHandleExceptionAndExitWithError() {
    properties.setRunOnce(true);
    when(updateRunner.execute(anyBoolean())).thenThrow(new IllegalStateException("Fatal"));

    app.run();

    verify(shutdownManager).exit(1);
  }

  @Test
  void shouldStillStartWhenEverySourceIsDisabled() {
    sourcesConfig.getIshares().setEnabled(false);
    sourcesConfig.getGoldmanSachs().setEnabled(false);
    sourcesConfig.getAlphaArchitect().setEnabled(false);
    properties.setRunOnce(true);

    app.run();

    verify(updateRunner).execute(false);
    verify(shutdownManager).exit(0);
  }
}
