package com.example.taskreminder.controller;

import com.example.taskreminder.domain.enums.TaskStatus;
import com.example.taskreminder.dto.ApiResponse;
import com.example.taskreminder.dto.ParticipantResponse;
import com.example.taskreminder.dto.RegisterParticipantRequest;
import com.example.taskreminder.dto.TaskResponse;
import com.example.taskreminder.service.ParticipantService;
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
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/participants")
@Tag(name = "Participants", description = "APIs for chat participants and their reminder preferences")
public class ParticipantController {

    private final ParticipantService participantService;
    private final TaskManagementService taskManagementService;

    @PostMapping
    @Operation(summary = "Register a participant", description = "Create a participant or refresh its handle and display name")
    public ResponseEntity<ApiResponse<ParticipantResponse>> register(@Valid @RequestBody RegisterParticipantRequest request) {
        log.info("API: Register participant {}", request.getId());

        var response = participantService.register(request);
        return ResponseEntity.ok(ApiResponse.success(response, "Participant registered"));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get participant by ID")
    public ResponseEntity<ApiResponse<ParticipantResponse>> getParticipant(@Parameter(description = "Participant ID") @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(participantService.getParticipant(id)));
    }

    @GetMapping
    @Operation(summary = "List participants", description = "Page through registered participants")
    public ResponseEntity<ApiResponse<Page<ParticipantResponse>>> listParticipants(
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size,
            @Parameter(description = "Sort field") @RequestParam(defaultValue = "createdAt") String sortBy,
            @Parameter(description = "Sort direction") @RequestParam(defaultValue = "DESC") String sortDir) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.fromString(sortDir), sortBy));
        return ResponseEntity.ok(ApiResponse.success(participantService.listParticipants(pageable)));
    }

    @GetMapping("/{id}/tasks")
    @Operation(summary = "List a participant's tasks", description = "Tasks assigned to a participant; DONE tasks are hidden unless requested by status")
    public ResponseEntity<ApiResponse<List<TaskResponse>>> getTasksForParticipant(
            @Parameter(description = "Participant ID") @PathVariable Long id,
            @Parameter(description = "Status filter") @RequestParam(required = false) TaskStatus status) {

        var tasks = taskManagementService.getTasksForParticipant(id, status);
        return ResponseEntity.ok(ApiResponse.success(tasks));
    }

    @PutMapping("/{id}/reminders")
    @Operation(summary = "Toggle reminders", description = "Opt a participant in or out of reminder mentions")
    public ResponseEntity<ApiResponse<ParticipantResponse>> setRemindersEnabled(
            @Parameter(description = "Participant ID") @PathVariable Long id,
            @Parameter(description = "Whether reminders are enabled") @RequestParam boolean enabled) {
        log.info("API: Set reminders for participant {} to {}", id, enabled);

        var response = participantService.setRemindersEnabled(id, enabled);
        return ResponseEntity.ok(ApiResponse.success(response, enabled ? "Reminders enabled" : "Reminders disabled"));
    }
}
