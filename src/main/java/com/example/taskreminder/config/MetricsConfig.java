package com.example.taskreminder.config;

import com.example.taskreminder.domain.enums.TaskStatus;
import com.example.taskreminder.domain.repository.TaskRepository;
import com.example.taskreminder.service.reminder.TaskStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring reminder delivery.
 * <p>
 * Exposes Prometheus metrics for:
 * - Task counts by status
 * - Pending reminder backlog
 * - Reminder outcomes (delivered, failed, skipped)
 * - Tick durations and aborted ticks
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final TaskRepository taskRepository;
    private final TaskStore taskStore;

    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : TaskStatus.values()) {
            var key = "status_" + status.name().toLowerCase();
            gauges.put(key, new AtomicLong(0));

            Gauge.builder("task_reminder_tasks", gauges.get(key), AtomicLong::get)
                    .tag("status", status.name().toLowerCase())
                    .description("Number of tasks by status")
                    .register(meterRegistry);
        }

        gauges.put("pending_reminders", new AtomicLong(0));
        Gauge.builder("task_reminder_pending_reminders", gauges.get("pending_reminders"), AtomicLong::get)
                .description("Number of unsent reminders on open tasks")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from the database
     */
    @Scheduled(fixedDelayString = "${task-reminder.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : TaskStatus.values()) {
                gauges.get("status_" + status.name().toLowerCase()).set(taskRepository.countByStatus(status));
            }
            gauges.get("pending_reminders").set(taskStore.countPendingReminders());
        } catch (Exception e) {
            log.warn("Failed to refresh reminder gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startTickTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTick(Timer.Sample sample, boolean completed) {
        sample.stop(Timer.builder("task_reminder_tick_time")
                .tag("completed", String.valueOf(completed))
                .description("Reminder tick duration")
                .register(meterRegistry));
    }

    /**
     * Record the outcome of one fired reminder: delivered, failed, no_recipients
     */
    public void recordReminderOutcome(String outcome) {
        meterRegistry.counter("task_reminder_reminders_fired", "outcome", outcome).increment();
    }

    public void recordMalformedReminder() {
        meterRegistry.counter("task_reminder_malformed_reminders").increment();
    }

    public void recordAbortedTick(String reason) {
        meterRegistry.counter("task_reminder_aborted_ticks", "reason", reason).increment();
    }
}
