package com.example.taskreminder.service.reminder;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a reminder fires on the current tick.
 * <p>
 * A reminder's fire window is the half-open interval
 * {@code [dueAt - offset, dueAt - offset + pollInterval)}. Under regular
 * polling exactly one tick lands inside it. A window that elapses while
 * no tick runs is missed for good: the reminder is never sent late.
 */
@Component
public class DueWindowEvaluator {

    public Instant fireAt(Instant dueAt, int offsetMinutes) {
        return dueAt.minus(Duration.ofMinutes(offsetMinutes));
    }

    public boolean isDue(Instant now, Instant dueAt, int offsetMinutes, Duration pollInterval) {
        var fireAt = fireAt(dueAt, offsetMinutes);
        return !now.isBefore(fireAt) && now.isBefore(fireAt.plus(pollInterval));
    }

    /**
     * @return true if the whole fire window lies in the past
     */
    public boolean isMissed(Instant now, Instant dueAt, int offsetMinutes, Duration pollInterval) {
        return !now.isBefore(fireAt(dueAt, offsetMinutes).plus(pollInterval));
    }
}
