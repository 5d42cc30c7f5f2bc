package com.example.taskreminder.domain.repository;

import com.example.taskreminder.domain.entity.Task;
import com.example.taskreminder.domain.enums.TaskStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Task entity.
 */
@Repository
public interface TaskRepository extends JpaRepository<Task, Long> {

    Optional<Task> findByCode(String code);

    Page<Task> findByStatus(TaskStatus status, Pageable pageable);

    Page<Task> findByChatId(String chatId, Pageable pageable);

    Page<Task> findByChatIdAndStatus(String chatId, TaskStatus status, Pageable pageable);

    /**
     * Tasks assigned to a participant, excluding the given status, soonest deadline first
     */
    @Query("""
            SELECT t FROM Task t JOIN t.assignees a
            WHERE a.id = :participantId
              AND t.status <> :excludedStatus
            ORDER BY t.dueAt ASC
            """)
    List<Task> findAssignedExcludingStatus(@Param("participantId") Long participantId,
                                           @Param("excludedStatus") TaskStatus excludedStatus);

    /**
     * Tasks assigned to a participant in the given status, soonest deadline first
     */
    @Query("""
            SELECT t FROM Task t JOIN t.assignees a
            WHERE a.id = :participantId
              AND t.status = :status
            ORDER BY t.dueAt ASC
            """)
    List<Task> findAssignedWithStatus(@Param("participantId") Long participantId,
                                      @Param("status") TaskStatus status);

    long countByStatus(TaskStatus status);
}
