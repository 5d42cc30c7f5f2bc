package com.example.taskreminder.exception;

import lombok.Getter;

/**
 * Exception for task not found
 */
@Getter
public class TaskNotFoundException extends RuntimeException {

    private final String taskCode;

    public TaskNotFoundException(String taskCode) {
        super("Task not found: " + taskCode);
        this.taskCode = taskCode;
    }
}
