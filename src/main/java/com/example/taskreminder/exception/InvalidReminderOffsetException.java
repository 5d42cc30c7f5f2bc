package com.example.taskreminder.exception;

import lombok.Getter;

/**
 * Exception for a reminder offset that is missing, zero or negative
 */
@Getter
public class InvalidReminderOffsetException extends IllegalArgumentException {

    private final Integer offsetMinutes;

    public InvalidReminderOffsetException(Integer offsetMinutes) {
        super(String.format("Reminder offset must be a positive number of minutes, got %s", offsetMinutes));
        this.offsetMinutes = offsetMinutes;
    }
}
