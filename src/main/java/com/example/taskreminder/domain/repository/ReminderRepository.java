package com.example.taskreminder.domain.repository;

import com.example.taskreminder.domain.entity.Reminder;
import com.example.taskreminder.domain.enums.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Reminder entity.
 * <p>
 * The scheduler is the only writer of the sent flag; everything else
 * replaces reminders through the owning Task.
 */
@Repository
public interface ReminderRepository extends JpaRepository<Reminder, Long> {

    /**
     * Unsent reminders on tasks that are not DONE, with task and assignees
     * loaded so they can be detached into value objects.
     */
    @Query("""
            SELECT DISTINCT r FROM Reminder r
            JOIN FETCH r.task t
            LEFT JOIN FETCH t.assignees
            WHERE r.sent = false
              AND t.status <> :doneStatus
            ORDER BY r.id ASC
            """)
    List<Reminder> findPendingReminders(@Param("doneStatus") TaskStatus doneStatus);

    /**
     * Flip the sent flag. Marking an already-sent reminder is a no-op update.
     *
     * @return number of rows matched (1 if the reminder exists, 0 otherwise)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Reminder r SET r.sent = true WHERE r.id = :reminderId")
    int markSent(@Param("reminderId") Long reminderId);

    @Query("""
            SELECT COUNT(r) FROM Reminder r
            WHERE r.sent = false
              AND r.task.status <> :doneStatus
            """)
    long countPending(@Param("doneStatus") TaskStatus doneStatus);

    List<Reminder> findByTaskIdOrderByIdAsc(Long taskId);
}
