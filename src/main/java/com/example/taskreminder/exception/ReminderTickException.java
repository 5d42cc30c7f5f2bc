package com.example.taskreminder.exception;

/**
 * Thrown when a reminder tick fails unexpectedly, as opposed to being
 * skipped because another tick holds the lock
 */
public class ReminderTickException extends RuntimeException {

    public ReminderTickException(String message, Throwable cause) {
        super(message, cause);
    }
}
