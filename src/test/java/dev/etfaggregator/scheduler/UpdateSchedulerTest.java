package dev.etfaggregator.scheduler;

import dev.etfaggregator.model.UpdateSummary;
import dev.etfaggregator.service.UpdateOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateSchedulerTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    // 16:00 in New York
    private static final Instant NOW = Instant.parse("2024-05-01T20:00:00Z");

    @Mock
    private UpdateOrchestrator orchestrator;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private UpdateScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new UpdateScheduler(orchestrator, taskScheduler, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void stubSchedule() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should start stopped with no next run")
        void shouldStartStopped() {
            assertThat(scheduler.isRunning()).isFalse();
            assertThat(scheduler.nextRunTime()).isEmpty();
            assertThat(scheduler.status().running()).isFalse();
        }

        @Test
        @DisplayName("Should schedule a daily cron trigger in the given zone")
        void shouldScheduleDailyTrigger() {
            stubSchedule();

            scheduler.start(18, 0, NEW_YORK);

            verify(taskScheduler).schedule(any(Runnable.class),
                    argThat((Trigger trigger) -> trigger instanceof CronTrigger cron
                            && cron.getExpression().equals("0 0 18 * * *")));
            assertThat(scheduler.isRunning()).isTrue();
        }

        @Test
        @DisplayName("Should ignore a second start")
        void shouldBeIdempotentOnStart() {
            stubSchedule();

            scheduler.start(18, 0, NEW_YORK);
            scheduler.start(9, 30, NEW_YORK);

            verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Trigger.class));
            assertThat(scheduler.status().hour()).isEqualTo(18);
        }

        @Test
        @DisplayName("Should cancel on stop and tolerate repeated stops")
        void shouldStopIdempotently() {
            stubSchedule();
            scheduler.start(18, 0, NEW_YORK);

            scheduler.stop();
            scheduler.stop();

            verify(future, times(1)).cancel(false);
            assertThat(scheduler.isRunning()).isFalse();
            assertThat(scheduler.nextRunTime()).isEmpty();
        }

        @Test
        @DisplayName("Should reject out-of-range times")
        void shouldRejectInvalidTime() {
            assertThatThrownBy(() -> scheduler.start(24, 0, NEW_YORK))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> scheduler.start(18, 60, NEW_YORK))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(scheduler.isRunning()).isFalse();
        }
    }

    @Nested
    @DisplayName("Next run")
    class NextRun {

        @Test
        @DisplayName("Should fire later the same day when the time has not passed")
        void shouldFireSameDay() {
            stubSchedule();
            scheduler.start(18, 0, NEW_YORK);

            assertThat(scheduler.nextRunTime())
                    .contains(ZonedDateTime.of(2024, 5, 1, 18, 0, 0, 0, NEW_YORK));
        }

        @Test
        @DisplayName("Should roll over to tomorrow when the time has passed")
        void shouldFireNextDay() {
            stubSchedule();
            scheduler.start(9, 30, NEW_YORK);

            assertThat(scheduler.nextRunTime())
                    .contains(ZonedDateTime.of(2024, 5, 2, 9, 30, 0, 0, NEW_YORK));
        }

        @Test
        @DisplayName("Should report zone and time in the status")
        void shouldReportStatus() {
            stubSchedule();
            scheduler.start(18, 0, NEW_YORK);

            SchedulerStatus status = scheduler.status();

            assertThat(status.running()).isTrue();
            assertThat(status.zone()).isEqualTo("America/New_York");
            assertThat(status.hour()).isEqualTo(18);
            assertThat(status.minute()).isZero();
            assertThat(status.nextRun()).isEqualTo(ZonedDateTime.of(2024, 5, 1, 18, 0, 0, 0, NEW_YORK));
        }
    }

    @Nested
    @DisplayName("Runs")
    class Runs {

        @Test
        @DisplayName("Should run a non-forced update on demand")
        void shouldRunNow() {
            UpdateSummary summary = UpdateSummary.of(List.of(), NOW);
            when(orchestrator.updateAll(false)).thenReturn(Mono.just(summary));

            scheduler.runNow();

            verify(orchestrator, timeout(1000)).updateAll(false);
        }

        @Test
        @DisplayName("Should not throw when the scheduled update fails")
        void shouldContainScheduledFailure() {
            when(orchestrator.updateAll(false)).thenReturn(Mono.error(new IllegalStateException("boom")));

            assertThatCode(() -> scheduler.runScheduledUpdate()).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should run a non-forced update when triggered")
        void shouldRunScheduledUpdate() {
            when(orchestrator.updateAll(false)).thenReturn(Mono.just(UpdateSummary.of(List.of(), NOW)));

            scheduler.runScheduledUpdate();

            verify(orchestrator).updateAll(false);
        }
    }
}
