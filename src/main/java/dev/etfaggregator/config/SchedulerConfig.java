package dev.etfaggregator.config;

import dev.etfaggregator.scheduler.UpdateScheduler;
import dev.etfaggregator.service.UpdateOrchestrator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler updateTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("etf-update-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(destroyMethod = "stop")
    public UpdateScheduler updateScheduler(UpdateOrchestrator orchestrator,
                                           ThreadPoolTaskScheduler updateTaskScheduler,
                                           Clock clock) {
        return new UpdateScheduler(orchestrator, updateTaskScheduler, clock);
    }
}
