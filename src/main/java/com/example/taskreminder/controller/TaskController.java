package com.example.taskreminder.controller;

import com.example.taskreminder.domain.enums.TaskStatus;
import com.example.taskreminder.dto.*;
import com.example.taskreminder.service.TaskManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API controller for task management operations.
 * <p>
 * Provides endpoints for:
 * - Creating and deleting tasks
 * - Retrieving a task by code and searching tasks
 * - Editing a task and advancing its status
 * - Assigning participants and editing reminder offsets
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/tasks")
@Tag(name = "Task Management", description = "APIs for managing group tasks and their reminders")
public class TaskController {

    private final TaskManagementService taskManagementService;

    // === Task Creation ===

    @PostMapping
    @Operation(summary = "Create a new task", description = "Create a task with a deadline, assignees and reminder offsets")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<TaskResponse>> createTask(@Valid @RequestBody CreateTaskRequest request) {
        log.info("API: Create task '{}' in chat {}", request.getName(), request.getChatId());

        var response = taskManagementService.createTask(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Task created successfully"));
    }

    // === Task Retrieval ===

    @GetMapping("/{code}")
    @Operation(summary = "Get task by code", description = "Retrieve a task by its code, e.g. TK0001")
    public ResponseEntity<ApiResponse<TaskResponse>> getTask(@Parameter(description = "Task code") @PathVariable String code) {
        return ResponseEntity.ok(ApiResponse.success(taskManagementService.getTask(code)));
    }

    @GetMapping
    @Operation(summary = "Search tasks", description = "Search tasks with optional filters")
    public ResponseEntity<ApiResponse<Page<TaskResponse>>> searchTasks(
            @Parameter(description = "Status filter") @RequestParam(required = false) TaskStatus status,
            @Parameter(description = "Chat ID filter") @RequestParam(required = false) String chatId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size,
            @Parameter(description = "Sort field") @RequestParam(defaultValue = "createdAt") String sortBy,
            @Parameter(description = "Sort direction") @RequestParam(defaultValue = "DESC") String sortDir) {

        var criteria = TaskSearchCriteria.builder().status(status).chatId(chatId).build();
        var sort = Sort.by(Sort.Direction.fromString(sortDir), sortBy);
        var pageable = PageRequest.of(page, size, sort);

        var tasks = taskManagementService.searchTasks(criteria, pageable);
        return ResponseEntity.ok(ApiResponse.success(tasks));
    }

    // === Task Updates ===

    @PutMapping("/{code}")
    @Operation(summary = "Update a task", description = "Edit name, chat or deadline; a new deadline resets the reminders to unsent")
    public ResponseEntity<ApiResponse<TaskResponse>> updateTask(
            @Parameter(description = "Task code") @PathVariable String code,
            @Valid @RequestBody UpdateTaskRequest request) {
        log.info("API: Update task {}", code);

        var response = taskManagementService.updateTask(code, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Task updated"));
    }

    @PutMapping("/{code}/status")
    @Operation(summary = "Update task status", description = "Move a task forward: NEW, IN_PROGRESS, DONE")
    public ResponseEntity<ApiResponse<TaskResponse>> updateStatus(
            @Parameter(description = "Task code") @PathVariable String code,
            @Valid @RequestBody UpdateStatusRequest request) {
        log.info("API: Update task {} status to {}", code, request.getStatus());

        var response = taskManagementService.updateStatus(code, request.getStatus());
        return ResponseEntity.ok(ApiResponse.success(response, "Task status updated"));
    }

    @PutMapping("/{code}/reminders")
    @Operation(summary = "Replace reminders", description = "Replace all reminders of a task; an empty list turns reminders off")
    public ResponseEntity<ApiResponse<TaskResponse>> replaceReminders(
            @Parameter(description = "Task code") @PathVariable String code,
            @Valid @RequestBody UpdateRemindersRequest request) {
        log.info("API: Replace reminders of task {} with {}", code, request.getReminderOffsets());

        var response = taskManagementService.replaceReminders(code, request.getReminderOffsets());
        var message = response.getReminders().isEmpty() ? "Reminders turned off" : "Reminders updated";
        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    @PostMapping("/{code}/assignees/{participantId}")
    @Operation(summary = "Assign a participant", description = "Add a participant to the task's assignees")
    public ResponseEntity<ApiResponse<TaskResponse>> assignParticipant(
            @Parameter(description = "Task code") @PathVariable String code,
            @Parameter(description = "Participant ID") @PathVariable Long participantId) {
        log.info("API: Assign participant {} to task {}", participantId, code);

        var response = taskManagementService.assignParticipant(code, participantId);
        return ResponseEntity.ok(ApiResponse.success(response, "Participant assigned"));
    }

    @DeleteMapping("/{code}")
    @Operation(summary = "Delete a task", description = "Delete a task together with its reminders")
    public ResponseEntity<ApiResponse<Void>> deleteTask(@Parameter(description = "Task code") @PathVariable String code) {
        log.info("API: Delete task {}", code);

        taskManagementService.deleteTask(code);
        return ResponseEntity.ok(ApiResponse.success(null, "Task deleted"));
    }
}
