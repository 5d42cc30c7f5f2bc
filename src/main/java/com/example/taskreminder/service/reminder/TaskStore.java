package com.example.taskreminder.service.reminder;

import java.util.List;

/**
 * Storage operations consumed by the reminder scheduler.
 * <p>
 * Implementations must return detached value objects and rely on the
 * underlying store for atomicity of each mark-sent write. Failures are
 * reported as unchecked exceptions.
 */
public interface TaskStore {

    /**
     * @return every reminder with sent=false whose task is not DONE
     */
    List<PendingReminder> listPendingReminders();

    /**
     * Set the reminder's sent flag. Idempotent: marking an already-sent
     * reminder succeeds without effect.
     *
     * @return true if the reminder exists
     */
    boolean markReminderSent(Long reminderId);

    /**
     * @return number of reminders the next tick would consider
     */
    long countPendingReminders();
}
