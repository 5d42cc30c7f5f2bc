package com.example.taskreminder.service.reminder;

import com.example.taskreminder.domain.entity.Participant;
import com.example.taskreminder.domain.entity.Reminder;
import com.example.taskreminder.domain.entity.Task;
import com.example.taskreminder.domain.enums.TaskStatus;
import com.example.taskreminder.domain.repository.ReminderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

/**
 * JPA-backed {@link TaskStore}.
 * <p>
 * Each call runs in its own short transaction and converts entities to
 * snapshots before returning, so the scheduler never holds a session
 * across a notification call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTaskStore implements TaskStore {

    private final ReminderRepository reminderRepository;

    @Override
    @Transactional(readOnly = true)
    public List<PendingReminder> listPendingReminders() {
        return reminderRepository.findPendingReminders(TaskStatus.DONE).stream()
                .map(this::toPendingReminder)
                .toList();
    }

    @Override
    @Transactional
    public boolean markReminderSent(Long reminderId) {
        var updated = reminderRepository.markSent(reminderId);
        if (updated == 0) {
            log.warn("Reminder {} no longer exists, cannot mark as sent", reminderId);
            return false;
        }
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public long countPendingReminders() {
        return reminderRepository.countPending(TaskStatus.DONE);
    }

    private PendingReminder toPendingReminder(Reminder reminder) {
        return PendingReminder.builder()
                .reminderId(reminder.getId())
                .offsetMinutes(reminder.getOffsetMinutes())
                .sent(reminder.isSent())
                .task(toTaskSnapshot(reminder.getTask()))
                .build();
    }

    private TaskSnapshot toTaskSnapshot(Task task) {
        var assignees = task.getAssignees().stream()
                .sorted(Comparator.comparing(Participant::getId))
                .map(p -> AssigneeSnapshot.builder()
                        .id(p.getId())
                        .handle(p.getHandle())
                        .displayName(p.getDisplayName())
                        .optedIn(p.isRemindersEnabled())
                        .build())
                .toList();

        return TaskSnapshot.builder()
                .id(task.getId())
                .code(task.getCode())
                .name(task.getName())
                .chatId(task.getChatId())
                .dueAt(task.getDueAt())
                .status(task.getStatus())
                .assignees(assignees)
                .build();
    }
}
