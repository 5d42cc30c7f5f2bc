package com.example.taskreminder.controller;

import com.example.taskreminder.domain.enums.TaskStatus;
import com.example.taskreminder.dto.CreateTaskRequest;
import com.example.taskreminder.dto.TaskResponse;
import com.example.taskreminder.dto.TaskSearchCriteria;
import com.example.taskreminder.dto.UpdateRemindersRequest;
import com.example.taskreminder.dto.UpdateStatusRequest;
import com.example.taskreminder.dto.UpdateTaskRequest;
import com.example.taskreminder.exception.InvalidReminderOffsetException;
import com.example.taskreminder.exception.InvalidTaskStateException;
import com.example.taskreminder.exception.TaskNotFoundException;
import com.example.taskreminder.service.TaskManagementService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
@DisplayName("TaskController Tests")
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private TaskManagementService taskManagementService;

    private TaskResponse taskResponse(TaskStatus status) {
        return TaskResponse.builder()
                .id(1L)
                .code("TK0001")
                .name("Ship v2")
                .chatId("C012AB3CD")
                .dueAt(Instant.parse("2025-01-10T15:00:00Z"))
                .status(status)
                .assignees(List.of())
                .reminders(List.of())
                .build();
    }

    @Nested
    @DisplayName("Task Creation API")
    class TaskCreationApiTests {

        @Test
        @DisplayName("Should create task")
        void shouldCreateTask() throws Exception {
            var request = CreateTaskRequest.builder()
                    .name("Ship v2")
                    .chatId("C012AB3CD")
                    .dueAt(Instant.parse("2025-01-10T15:00:00Z"))
                    .reminderOffsets(List.of(60, 15))
                    .build();
            when(taskManagementService.createTask(any(CreateTaskRequest.class))).thenReturn(taskResponse(TaskStatus.NEW));

            mockMvc.perform(post("/api/v1/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.data.code").value("TK0001"))
                    .andExpect(jsonPath("$.data.status").value("NEW"));
        }

        @Test
        @DisplayName("Should reject request without name")
        void shouldRejectRequestWithoutName() throws Exception {
            var request = CreateTaskRequest.builder()
                    .chatId("C012AB3CD")
                    .dueAt(Instant.parse("2025-01-10T15:00:00Z"))
                    .build();

            mockMvc.perform(post("/api/v1/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.success").value(false))
                    .andExpect(jsonPath("$.errors", hasSize(1)));

            verifyNoInteractions(taskManagementService);
        }

        @Test
        @DisplayName("Should map invalid offsets to bad request")
        void shouldMapInvalidOffsetsToBadRequest() throws Exception {
            var request = CreateTaskRequest.builder()
                    .name("Ship v2")
                    .chatId("C012AB3CD")
                    .dueAt(Instant.parse("2025-01-10T15:00:00Z"))
                    .reminderOffsets(List.of(-5))
                    .build();
            when(taskManagementService.createTask(any(CreateTaskRequest.class))).thenThrow(new InvalidReminderOffsetException(-5));

            mockMvc.perform(post("/api/v1/tasks")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value(containsString("-5")));
        }
    }

    @Nested
    @DisplayName("Task Retrieval API")
    class TaskRetrievalApiTests {

        @Test
        @DisplayName("Should get task by code")
        void shouldGetTaskByCode() throws Exception {
            when(taskManagementService.getTask("TK0001")).thenReturn(taskResponse(TaskStatus.NEW));

            mockMvc.perform(get("/api/v1/tasks/TK0001"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.name").value("Ship v2"));
        }

        @Test
        @DisplayName("Should return 404 for unknown task")
        void shouldReturn404ForUnknownTask() throws Exception {
            when(taskManagementService.getTask("TK9999")).thenThrow(new TaskNotFoundException("TK9999"));

            mockMvc.perform(get("/api/v1/tasks/TK9999"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("Should search tasks with filters and paging")
        void shouldSearchTasks() throws Exception {
            var page = new PageImpl<>(List.of(taskResponse(TaskStatus.IN_PROGRESS)), PageRequest.of(1, 5), 6);
            when(taskManagementService.searchTasks(any(TaskSearchCriteria.class), any(Pageable.class))).thenReturn(page);

            mockMvc.perform(get("/api/v1/tasks")
                            .param("status", "IN_PROGRESS")
                            .param("chatId", "C012AB3CD")
                            .param("page", "1")
                            .param("size", "5")
                            .param("sortBy", "dueAt")
                            .param("sortDir", "ASC"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.content", hasSize(1)))
                    .andExpect(jsonPath("$.data.totalElements").value(6));

            var criteriaCaptor = ArgumentCaptor.forClass(TaskSearchCriteria.class);
            var pageableCaptor = ArgumentCaptor.forClass(Pageable.class);
            verify(taskManagementService).searchTasks(criteriaCaptor.capture(), pageableCaptor.capture());
            assertThat(criteriaCaptor.getValue().getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
            assertThat(criteriaCaptor.getValue().getChatId()).isEqualTo("C012AB3CD");
            assertThat(pageableCaptor.getValue().getPageNumber()).isEqualTo(1);
            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(5);
            assertThat(pageableCaptor.getValue().getSort().getOrderFor("dueAt").getDirection()).isEqualTo(Sort.Direction.ASC);
        }

        @Test
        @DisplayName("Should search with default paging, newest first")
        void shouldSearchWithDefaultPaging() throws Exception {
            when(taskManagementService.searchTasks(any(TaskSearchCriteria.class), any(Pageable.class)))
                    .thenReturn(new PageImpl<>(List.of()));

            mockMvc.perform(get("/api/v1/tasks"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.content", hasSize(0)));

            var pageableCaptor = ArgumentCaptor.forClass(Pageable.class);
            verify(taskManagementService).searchTasks(any(TaskSearchCriteria.class), pageableCaptor.capture());
            assertThat(pageableCaptor.getValue().getPageNumber()).isZero();
            assertThat(pageableCaptor.getValue().getPageSize()).isEqualTo(20);
            assertThat(pageableCaptor.getValue().getSort().getOrderFor("createdAt").getDirection()).isEqualTo(Sort.Direction.DESC);
        }

        @Test
        @DisplayName("Should reject unknown status filter")
        void shouldRejectUnknownStatusFilter() throws Exception {
            mockMvc.perform(get("/api/v1/tasks").param("status", "PAUSED"))
                    .andExpect(status().isBadRequest());

            verifyNoInteractions(taskManagementService);
        }
    }

    @Nested
    @DisplayName("Task Update API")
    class TaskUpdateApiTests {

        @Test
        @DisplayName("Should edit name, chat and deadline")
        void shouldUpdateTask() throws Exception {
            var request = UpdateTaskRequest.builder()
                    .name("Ship v3")
                    .dueAt(Instant.parse("2025-01-11T15:00:00Z"))
                    .build();
            var response = taskResponse(TaskStatus.NEW);
            response.setName("Ship v3");
            when(taskManagementService.updateTask(eq("TK0001"), any(UpdateTaskRequest.class))).thenReturn(response);

            mockMvc.perform(put("/api/v1/tasks/TK0001")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Task updated"))
                    .andExpect(jsonPath("$.data.name").value("Ship v3"));
        }

        @Test
        @DisplayName("Should reject an empty task name on update")
        void shouldRejectEmptyNameOnUpdate() throws Exception {
            mockMvc.perform(put("/api/v1/tasks/TK0001")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\": \"\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Validation failed"));

            verifyNoInteractions(taskManagementService);
        }

        @Test
        @DisplayName("Should reject a past deadline on update")
        void shouldRejectPastDeadlineOnUpdate() throws Exception {
            when(taskManagementService.updateTask(eq("TK0001"), any(UpdateTaskRequest.class)))
                    .thenThrow(new IllegalArgumentException("Due date must be in the future"));

            mockMvc.perform(put("/api/v1/tasks/TK0001")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"dueAt\": \"2020-01-01T00:00:00Z\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value("Due date must be in the future"));
        }

        @Test
        @DisplayName("Should update status")
        void shouldUpdateStatus() throws Exception {
            when(taskManagementService.updateStatus("TK0001", TaskStatus.DONE)).thenReturn(taskResponse(TaskStatus.DONE));

            mockMvc.perform(put("/api/v1/tasks/TK0001/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new UpdateStatusRequest(TaskStatus.DONE))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.status").value("DONE"));
        }

        @Test
        @DisplayName("Should return 409 for backward status change")
        void shouldReturn409ForBackwardStatusChange() throws Exception {
            when(taskManagementService.updateStatus("TK0001", TaskStatus.NEW))
                    .thenThrow(new InvalidTaskStateException("TK0001", "DONE", "NEW"));

            mockMvc.perform(put("/api/v1/tasks/TK0001/status")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new UpdateStatusRequest(TaskStatus.NEW))))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("Should report reminders turned off for an empty list")
        void shouldReportRemindersOff() throws Exception {
            when(taskManagementService.replaceReminders("TK0001", List.of())).thenReturn(taskResponse(TaskStatus.NEW));

            mockMvc.perform(put("/api/v1/tasks/TK0001/reminders")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new UpdateRemindersRequest(List.of()))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.message").value("Reminders turned off"));
        }

        @Test
        @DisplayName("Should return 409 for duplicate assignment")
        void shouldReturn409ForDuplicateAssignment() throws Exception {
            when(taskManagementService.assignParticipant(eq("TK0001"), eq(101L)))
                    .thenThrow(new IllegalStateException("Participant 101 is already assigned to task TK0001"));

            mockMvc.perform(post("/api/v1/tasks/TK0001/assignees/101"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.message").value("Participant 101 is already assigned to task TK0001"));
        }

        @Test
        @DisplayName("Should delete task")
        void shouldDeleteTask() throws Exception {
            mockMvc.perform(delete("/api/v1/tasks/TK0001"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(true));

            verify(taskManagementService).deleteTask("TK0001");
        }
    }
}
