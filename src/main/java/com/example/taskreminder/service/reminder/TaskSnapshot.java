package com.example.taskreminder.service.reminder;

import com.example.taskreminder.domain.enums.TaskStatus;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Detached view of a task as seen by the reminder scan
 */
@Value
@Builder
public class TaskSnapshot {

    Long id;
    String code;
    String name;
    String chatId;
    Instant dueAt;
    TaskStatus status;

    @Singular
    List<AssigneeSnapshot> assignees;
}
