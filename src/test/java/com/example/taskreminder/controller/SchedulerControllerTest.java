package com.example.taskreminder.controller;

import com.example.taskreminder.config.TaskReminderProperties;
import com.example.taskreminder.exception.ReminderTickException;
import com.example.taskreminder.service.reminder.ReminderScheduler;
import com.example.taskreminder.service.reminder.SchedulerState;
import com.example.taskreminder.service.reminder.TaskStore;
import com.example.taskreminder.service.reminder.TickResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SchedulerController.class)
@DisplayName("SchedulerController Tests")
class SchedulerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReminderScheduler reminderScheduler;

    @MockBean
    private TaskStore taskStore;

    @MockBean
    private TaskReminderProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.getPollIntervalMinutes()).thenReturn(1);
        when(taskStore.countPendingReminders()).thenReturn(4L);
    }

    @Test
    @DisplayName("Should report scheduler status")
    void shouldReportStatus() throws Exception {
        when(reminderScheduler.getState()).thenReturn(SchedulerState.RUNNING);

        mockMvc.perform(get("/api/v1/scheduler"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("RUNNING"))
                .andExpect(jsonPath("$.data.pollIntervalMinutes").value(1))
                .andExpect(jsonPath("$.data.pendingReminders").value(4));
    }

    @Test
    @DisplayName("Should stop scheduler")
    void shouldStopScheduler() throws Exception {
        when(reminderScheduler.getState()).thenReturn(SchedulerState.STOPPED);

        mockMvc.perform(post("/api/v1/scheduler/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("STOPPED"));

        verify(reminderScheduler).stop();
    }

    @Test
    @DisplayName("Should start scheduler")
    void shouldStartScheduler() throws Exception {
        when(reminderScheduler.getState()).thenReturn(SchedulerState.RUNNING);

        mockMvc.perform(post("/api/v1/scheduler/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Scheduler started"));

        verify(reminderScheduler).start();
    }

    @Test
    @DisplayName("Should run one tick on demand")
    void shouldRunTickOnDemand() throws Exception {
        when(reminderScheduler.triggerTick())
                .thenReturn(Optional.of(TickResult.builder().scanned(2).fired(1).delivered(1).build()));

        mockMvc.perform(post("/api/v1/scheduler/tick"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fired").value(1))
                .andExpect(jsonPath("$.data.delivered").value(1));
    }

    @Test
    @DisplayName("Should report a skipped tick as conflict")
    void shouldReportSkippedTick() throws Exception {
        when(reminderScheduler.triggerTick()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/scheduler/tick"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Tick skipped: another tick holds the reminder lock"));
    }

    @Test
    @DisplayName("Should report a failed tick as server error")
    void shouldReportFailedTick() throws Exception {
        when(reminderScheduler.triggerTick())
                .thenThrow(new ReminderTickException("Reminder tick failed", new IllegalStateException("database unavailable")));

        mockMvc.perform(post("/api/v1/scheduler/tick"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Reminder tick failed: database unavailable"));
    }
}
