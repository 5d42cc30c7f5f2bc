package com.example.taskreminder.service.reminder;

import lombok.Builder;
import lombok.Value;

/**
 * An unsent reminder together with the task it belongs to.
 * Plain value object: holds no reference to a persistence session.
 */
@Value
@Builder
public class PendingReminder {

    Long reminderId;
    int offsetMinutes;
    boolean sent;
    TaskSnapshot task;
}
