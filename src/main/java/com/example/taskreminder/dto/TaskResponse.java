package com.example.taskreminder.dto;

import com.example.taskreminder.domain.enums.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for task data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResponse {

    private Long id;
    private String code;
    private String name;
    private String chatId;
    private Instant dueAt;
    private TaskStatus status;
    private Instant createdAt;
    private List<ParticipantResponse> assignees;
    private List<ReminderResponse> reminders;
}
