package com.example.taskreminder.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Configuration for the reminder tick thread and the time source.
 * <p>
 * A single scheduler thread means two ticks can never execute
 * concurrently inside one instance; a late tick simply starts after
 * the previous one returns.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single-threaded scheduler driving the reminder tick.
     * The reminder scheduler manages its own graceful stop, so this pool
     * only waits briefly for a tick during context shutdown.
     */
    @Bean(name = "reminderTaskScheduler")
    public ThreadPoolTaskScheduler reminderTaskScheduler(TaskReminderProperties properties) {
        log.info("Configuring reminder tick scheduler with poll interval of {} minute(s)", properties.getPollIntervalMinutes());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reminder-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(properties.getShutdownTimeoutSeconds());
        scheduler.setErrorHandler(t -> log.error("Reminder tick failed: {}", t.getMessage(), t));

        return scheduler;
    }
}
