package com.example.taskreminder.dto;

import com.example.taskreminder.service.reminder.SchedulerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO describing the reminder scheduler
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatusResponse {

    private SchedulerState state;
    private int pollIntervalMinutes;
    private long pendingReminders;
}
