package com.example.taskreminder.service.reminder;

import lombok.Builder;
import lombok.Value;

/**
 * Detached view of a task assignee as seen by the reminder scan
 */
@Value
@Builder
public class AssigneeSnapshot {

    Long id;
    String handle;
    String displayName;
    boolean optedIn;

    /**
     * Prefer the @handle, fall back to the display name, then the id
     */
    public String mentionName() {
        if (handle != null && !handle.isBlank()) {
            return "@" + handle;
        }
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return "User " + id;
    }
}
