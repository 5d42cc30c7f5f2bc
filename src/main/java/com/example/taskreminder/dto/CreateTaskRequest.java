package com.example.taskreminder.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for creating a new task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    @NotBlank(message = "Task name is required")
    @Size(max = 500)
    private String name;

    @NotBlank(message = "Chat ID is required")
    private String chatId;

    /**
     * Deadline; must be in the future
     */
    @NotNull(message = "Due date is required")
    private Instant dueAt;

    /**
     * Participants to assign; unknown ids are ignored
     */
    private List<Long> assigneeIds;

    /**
     * Minutes before the deadline to send reminders.
     * Null uses the configured default, an empty list disables reminders.
     */
    private List<Integer> reminderOffsets;
}
