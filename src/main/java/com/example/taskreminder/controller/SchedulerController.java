package com.example.taskreminder.controller;

import com.example.taskreminder.config.TaskReminderProperties;
import com.example.taskreminder.dto.ApiResponse;
import com.example.taskreminder.dto.SchedulerStatusResponse;
import com.example.taskreminder.service.reminder.ReminderScheduler;
import com.example.taskreminder.service.reminder.TaskStore;
import com.example.taskreminder.service.reminder.TickResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Operator endpoints for the reminder scheduler
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/scheduler")
@Tag(name = "Reminder Scheduler", description = "APIs for controlling the reminder scheduler")
public class SchedulerController {

    private final ReminderScheduler reminderScheduler;
    private final TaskStore taskStore;
    private final TaskReminderProperties properties;

    @GetMapping
    @Operation(summary = "Get scheduler status", description = "Current state, poll interval and pending reminder count")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(currentStatus()));
    }

    @PostMapping("/start")
    @Operation(summary = "Start the scheduler", description = "Start ticking; a running scheduler has its recurring job replaced")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> start() {
        log.info("API: Start reminder scheduler");

        reminderScheduler.start();
        return ResponseEntity.ok(ApiResponse.success(currentStatus(), "Scheduler started"));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the scheduler", description = "Stop ticking; does nothing if already stopped")
    public ResponseEntity<ApiResponse<SchedulerStatusResponse>> stop() {
        log.info("API: Stop reminder scheduler");

        reminderScheduler.stop();
        return ResponseEntity.ok(ApiResponse.success(currentStatus(), "Scheduler stopped"));
    }

    @PostMapping("/tick")
    @Operation(summary = "Run one tick", description = "Scan and dispatch due reminders now; 409 if another tick holds the lock")
    public ResponseEntity<ApiResponse<TickResult>> triggerTick() {
        log.info("API: Trigger reminder tick");

        return reminderScheduler.triggerTick()
                .map(result -> ResponseEntity.ok(ApiResponse.success(result, "Tick completed")))
                .orElse(ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error("Tick skipped: another tick holds the reminder lock")));
    }

    private SchedulerStatusResponse currentStatus() {
        return SchedulerStatusResponse.builder()
                .state(reminderScheduler.getState())
                .pollIntervalMinutes(properties.getPollIntervalMinutes())
                .pendingReminders(taskStore.countPendingReminders())
                .build();
    }
}
