package com.example.taskreminder.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for editing a task. Null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTaskRequest {

    @Size(min = 1, max = 500, message = "Task name must be 1 to 500 characters")
    private String name;

    @Size(min = 1, max = 100, message = "Chat ID must be 1 to 100 characters")
    private String chatId;

    /**
     * New deadline; must be in the future. Changing it recreates the reminders unsent.
     */
    private Instant dueAt;
}
