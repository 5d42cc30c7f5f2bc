package com.example.taskreminder.domain.entity;

import com.example.taskreminder.domain.ReminderOffsets;
import com.example.taskreminder.domain.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A group task with a deadline, its assignees and its reminder set.
 * <p>
 * Supports:
 * - Stable human-readable task codes (TK0001)
 * - Many-to-many assignment to participants
 * - Any number of independent reminders, replaced wholesale on edit
 * - Cascading deletion of reminders with the task
 */
@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_task_status", columnList = "status"),
        @Index(name = "idx_task_chat_id", columnList = "chat_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Task {

    public static final String CODE_PREFIX = "TK";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Display handle, assigned from the id once the task is persisted
     */
    @Column(name = "code", unique = true, length = 20)
    private String code;

    @Column(name = "name", nullable = false, length = 500)
    private String name;

    /**
     * Chat (channel) the task belongs to and where reminders are posted
     */
    @Column(name = "chat_id", nullable = false, length = 100)
    private String chatId;

    /**
     * Deadline, always handled in UTC
     */
    @Column(name = "due_at", nullable = false)
    private Instant dueAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private TaskStatus status = TaskStatus.NEW;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "task", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("offsetMinutes DESC")
    @Builder.Default
    private List<Reminder> reminders = new ArrayList<>();

    @ManyToMany
    @JoinTable(name = "task_assignments",
            joinColumns = @JoinColumn(name = "task_id"),
            inverseJoinColumns = @JoinColumn(name = "participant_id"))
    @Builder.Default
    private Set<Participant> assignees = new LinkedHashSet<>();

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        if (this.status == null) {
            this.status = TaskStatus.NEW;
        }
    }

    public static String formatCode(long id) {
        return String.format("%s%04d", CODE_PREFIX, id);
    }

    /**
     * Add a fresh reminder set to a new task. An empty list means no reminders.
     */
    public void scheduleReminders(List<Integer> offsets) {
        for (var offset : ReminderOffsets.normalize(offsets)) {
            reminders.add(Reminder.forTask(this, offset));
        }
    }

    /**
     * Discard every existing reminder, sent or not, and create unsent ones
     * for the given offsets. Offsets are validated before anything is removed.
     */
    public void replaceReminders(List<Integer> offsets) {
        var normalized = ReminderOffsets.normalize(offsets);
        reminders.clear();
        for (var offset : normalized) {
            reminders.add(Reminder.forTask(this, offset));
        }
    }

    /**
     * Move the deadline and recreate the current reminder offsets as unsent,
     * so reminders already sent for the old deadline fire again for the new one.
     */
    public void reschedule(Instant newDueAt) {
        var offsets = reminders.stream().map(Reminder::getOffsetMinutes).toList();
        dueAt = newDueAt;
        replaceReminders(offsets);
    }

    /**
     * @return true if the participant was not assigned yet
     */
    public boolean assign(Participant participant) {
        return assignees.add(participant);
    }

    public boolean isAssignedTo(Long participantId) {
        return assignees.stream().anyMatch(p -> p.getId().equals(participantId));
    }
}
