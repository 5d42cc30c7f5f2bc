package com.example.taskreminder.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the reminder scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "task-reminder")
public class TaskReminderProperties {

    /**
     * Tick granularity in minutes; also the width of each reminder's fire window
     */
    @Min(1)
    private int pollIntervalMinutes = 1;

    /**
     * Offsets (minutes before due) used for tasks created without explicit reminders
     */
    @NotNull
    private List<Integer> defaultReminderOffsets = new ArrayList<>(List.of(30));

    /**
     * How long shutdown waits for the in-flight reminder to finish
     */
    @Min(1)
    private int shutdownTimeoutSeconds = 30;

    /**
     * Start the scheduler together with the application context
     */
    private boolean autoStart = true;

    /**
     * Upper bound for the distributed tick lock
     */
    @Min(1)
    private int lockAtMostForMinutes = 10;

    public Duration getPollInterval() {
        return Duration.ofMinutes(pollIntervalMinutes);
    }
}
