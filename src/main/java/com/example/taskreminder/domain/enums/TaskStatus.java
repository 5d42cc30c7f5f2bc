package com.example.taskreminder.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Task lifecycle status.
 * Status only moves forward: NEW, then IN_PROGRESS, then DONE.
 * The reminder scheduler never changes it.
 */
@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    /**
     * Task has been created and nobody has started it yet.
     */
    NEW("new", "New"),

    /**
     * Work on the task has started.
     */
    IN_PROGRESS("in_progress", "In Progress"),

    /**
     * Task is finished. Terminal state; its reminders are no longer scanned.
     */
    DONE("done", "Done");

    private final String code;
    private final String displayName;

    /**
     * Find TaskStatus by its code value (case-insensitive)
     */
    public static TaskStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }

    public boolean isTerminal() {
        return this == DONE;
    }

    /**
     * Check if a task in this status may move to the given status.
     * Staying in the same status is allowed.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return target != null && target.ordinal() >= this.ordinal();
    }
}
