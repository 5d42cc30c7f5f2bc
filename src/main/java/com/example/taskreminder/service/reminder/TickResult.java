package com.example.taskreminder.service.reminder;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one reminder tick
 */
@Value
@Builder
public class TickResult {

    /**
     * Unsent reminders examined
     */
    int scanned;

    /**
     * Reminders whose fire window contained this tick
     */
    int fired;

    int delivered;
    int failed;
    int noRecipients;

    /**
     * Pending reminders whose window already elapsed; they will never fire
     */
    int missed;

    int malformed;

    /**
     * True if a store error or a stop request ended the tick early
     */
    boolean aborted;
}
