package com.example.taskreminder.service.reminder;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What happened when a due reminder fired.
 * Every outcome consumes the reminder's single firing.
 */
@Getter
@RequiredArgsConstructor
public enum DeliveryOutcome {

    DELIVERED("delivered"),

    /**
     * Notifier rejected the message or threw
     */
    FAILED("failed"),

    /**
     * No assignee opted in, so nothing was sent
     */
    NO_RECIPIENTS("no_recipients");

    private final String metricTag;
}
