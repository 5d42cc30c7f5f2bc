package com.example.taskreminder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Task Reminder Service Application
 * <p>
 * Tracks group tasks assigned to chat participants and notifies them
 * before their deadlines.
 * <p>
 * Features:
 * - Multiple independent reminder offsets per task
 * - At-most-once reminder delivery with a half-open fire window
 * - Distributed tick locking so only one instance scans at a time
 * - Per-participant reminder opt-in
 * - Slack delivery of batched reminder messages
 */
@EnableScheduling
@SpringBootApplication
public class TaskReminderApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskReminderApplication.class, args);
    }
}
