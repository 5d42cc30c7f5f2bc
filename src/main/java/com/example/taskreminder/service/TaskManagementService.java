package com.example.taskreminder.service;

import com.example.taskreminder.config.TaskReminderProperties;
import com.example.taskreminder.domain.entity.Task;
import com.example.taskreminder.domain.enums.TaskStatus;
import com.example.taskreminder.domain.repository.ParticipantRepository;
import com.example.taskreminder.domain.repository.TaskRepository;
import com.example.taskreminder.dto.CreateTaskRequest;
import com.example.taskreminder.dto.TaskResponse;
import com.example.taskreminder.dto.TaskSearchCriteria;
import com.example.taskreminder.dto.UpdateTaskRequest;
import com.example.taskreminder.exception.InvalidTaskStateException;
import com.example.taskreminder.exception.ParticipantNotFoundException;
import com.example.taskreminder.exception.TaskNotFoundException;
import com.example.taskreminder.mapper.TaskMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Service for managing tasks, their assignees and their reminder sets.
 * <p>
 * Provides:
 * - Task creation with a default reminder set
 * - Lookup by task code, paged search and per-participant listing
 * - Editing name, chat and deadline
 * - Forward-only status changes
 * - Reminder replacement and assignment
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskManagementService {

    private final TaskRepository taskRepository;
    private final ParticipantRepository participantRepository;
    private final TaskMapper taskMapper;
    private final TaskReminderProperties properties;
    private final Clock clock;

    // === Task Creation ===

    /**
     * Create a task, assign the known participants and schedule its reminders.
     * Without explicit offsets the configured default set is used.
     */
    @Transactional
    public TaskResponse createTask(CreateTaskRequest request) {
        requireFutureDueDate(request.getDueAt());

        var task = Task.builder()
                .name(request.getName())
                .chatId(request.getChatId())
                .dueAt(request.getDueAt())
                .status(TaskStatus.NEW)
                .build();

        var offsets = request.getReminderOffsets() != null
                ? request.getReminderOffsets()
                : properties.getDefaultReminderOffsets();
        task.scheduleReminders(offsets);

        if (request.getAssigneeIds() != null) {
            participantRepository.findAllById(request.getAssigneeIds()).forEach(task::assign);
        }

        task = taskRepository.save(task);
        task.setCode(Task.formatCode(task.getId()));
        task = taskRepository.save(task);

        log.info("Created task {} in chat {} due at {} with {} reminder(s)",
                task.getCode(), task.getChatId(), task.getDueAt(), task.getReminders().size());

        return taskMapper.toResponse(task);
    }

    // === Task Retrieval ===

    @Transactional(readOnly = true)
    public TaskResponse getTask(String code) {
        return taskMapper.toResponse(findByCode(code));
    }

    /**
     * Tasks assigned to a participant. Without a status filter, DONE tasks are left out.
     */
    @Transactional(readOnly = true)
    public List<TaskResponse> getTasksForParticipant(Long participantId, TaskStatus status) {
        if (!participantRepository.existsById(participantId)) {
            throw new ParticipantNotFoundException(participantId);
        }

        var tasks = status != null
                ? taskRepository.findAssignedWithStatus(participantId, status)
                : taskRepository.findAssignedExcludingStatus(participantId, TaskStatus.DONE);

        return taskMapper.toResponseList(tasks);
    }

    /**
     * Search tasks with filters
     */
    @Transactional(readOnly = true)
    public Page<TaskResponse> searchTasks(TaskSearchCriteria criteria, Pageable pageable) {
        Page<Task> tasks;

        if (criteria.getChatId() != null && criteria.getStatus() != null) {
            tasks = taskRepository.findByChatIdAndStatus(criteria.getChatId(), criteria.getStatus(), pageable);
        } else if (criteria.getChatId() != null) {
            tasks = taskRepository.findByChatId(criteria.getChatId(), pageable);
        } else if (criteria.getStatus() != null) {
            tasks = taskRepository.findByStatus(criteria.getStatus(), pageable);
        } else {
            tasks = taskRepository.findAll(pageable);
        }

        return tasks.map(taskMapper::toResponse);
    }

    // === Task Updates ===

    /**
     * Edit the name, chat or deadline of a task. A changed deadline recreates
     * the task's reminders unsent with the same offsets; otherwise reminders are kept.
     */
    @Transactional
    public TaskResponse updateTask(String code, UpdateTaskRequest request) {
        var task = findByCode(code);

        if (request.getName() != null) {
            if (request.getName().isBlank()) {
                throw new IllegalArgumentException("Task name must not be blank");
            }
            task.setName(request.getName());
        }
        if (request.getChatId() != null) {
            if (request.getChatId().isBlank()) {
                throw new IllegalArgumentException("Chat ID must not be blank");
            }
            task.setChatId(request.getChatId());
        }
        if (request.getDueAt() != null && !request.getDueAt().equals(task.getDueAt())) {
            requireFutureDueDate(request.getDueAt());
            task.reschedule(request.getDueAt());
            log.info("Task {} rescheduled to {}, {} reminder(s) reset", code, request.getDueAt(), task.getReminders().size());
        }

        task = taskRepository.save(task);
        log.info("Updated task {}", code);

        return taskMapper.toResponse(task);
    }

    /**
     * Move a task forward in its lifecycle.
     *
     * @throws InvalidTaskStateException if the new status is behind the current one
     */
    @Transactional
    public TaskResponse updateStatus(String code, TaskStatus newStatus) {
        var task = findByCode(code);
        var current = task.getStatus();

        if (!current.canTransitionTo(newStatus)) {
            throw new InvalidTaskStateException(code, current.name(), String.valueOf(newStatus));
        }

        task.setStatus(newStatus);
        task = taskRepository.save(task);
        log.info("Task {} status changed from {} to {}", code, current, newStatus);

        return taskMapper.toResponse(task);
    }

    /**
     * Discard the task's reminders and create unsent ones for the given offsets.
     * An empty list leaves the task without reminders.
     */
    @Transactional
    public TaskResponse replaceReminders(String code, List<Integer> offsets) {
        var task = findByCode(code);
        task.replaceReminders(offsets);
        task = taskRepository.save(task);

        log.info("Task {} reminders replaced with offsets {}", code, offsets);
        return taskMapper.toResponse(task);
    }

    /**
     * @throws IllegalStateException if the participant is already assigned
     */
    @Transactional
    public TaskResponse assignParticipant(String code, Long participantId) {
        var task = findByCode(code);
        var participant = participantRepository.findById(participantId)
                .orElseThrow(() -> new ParticipantNotFoundException(participantId));

        if (!task.assign(participant)) {
            throw new IllegalStateException(
                    String.format("Participant %d is already assigned to task %s", participantId, code));
        }

        task = taskRepository.save(task);
        log.info("Assigned participant {} to task {}", participantId, code);
        return taskMapper.toResponse(task);
    }

    /**
     * Delete a task together with its reminders and assignments
     */
    @Transactional
    public void deleteTask(String code) {
        var task = findByCode(code);
        taskRepository.delete(task);
        log.info("Deleted task {}", code);
    }

    private void requireFutureDueDate(Instant dueAt) {
        if (!dueAt.isAfter(clock.instant())) {
            throw new IllegalArgumentException("Due date must be in the future");
        }
    }

    private Task findByCode(String code) {
        return taskRepository.findByCode(code).orElseThrow(() -> new TaskNotFoundException(code));
    }
}
