package com.example.taskreminder.domain.entity;

import com.example.taskreminder.domain.ReminderOffsets;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A single scheduled notification for a task, fired a fixed number of
 * minutes before the task is due.
 * <p>
 * The sent flag is only ever flipped to true by the reminder scheduler.
 */
@Entity
@Table(name = "reminders", indexes = {
        @Index(name = "idx_reminder_sent", columnList = "sent"),
        @Index(name = "idx_reminder_task_id", columnList = "task_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(access = AccessLevel.PRIVATE)
public class Reminder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false)
    private Task task;

    /**
     * Minutes before the task's due instant at which the reminder fires
     */
    @Column(name = "offset_minutes", nullable = false)
    private int offsetMinutes;

    @Column(name = "sent", nullable = false)
    private boolean sent;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Create an unsent reminder for the given task.
     *
     * @throws com.example.taskreminder.exception.InvalidReminderOffsetException if the offset is not positive
     */
    public static Reminder forTask(Task task, int offsetMinutes) {
        ReminderOffsets.requirePositive(offsetMinutes);
        return Reminder.builder()
                .task(task)
                .offsetMinutes(offsetMinutes)
                .sent(false)
                .createdAt(Instant.now())
                .build();
    }
}
