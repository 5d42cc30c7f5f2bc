package com.example.taskreminder.exception;

/**
 * Thrown when the recurring reminder tick cannot be registered.
 * Propagates to the host so the scheduler never runs with zero effect.
 */
public class SchedulerStartupException extends RuntimeException {

    public SchedulerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
