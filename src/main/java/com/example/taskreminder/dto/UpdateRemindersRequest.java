package com.example.taskreminder.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for replacing a task's reminder offsets.
 * An empty list turns reminders off for the task.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateRemindersRequest {

    @NotNull(message = "Reminder offsets are required")
    private List<Integer> reminderOffsets;
}
