package com.example.taskreminder.service.reminder;

import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Selects who is named in a reminder and renders the reminder text.
 * Uses Slack mrkdwn formatting.
 */
@Component
public class ReminderMessageComposer {

    private static final DateTimeFormatter DUE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private static final String TEMPLATE = """
            :bell: *Task Reminder*

            :clipboard: *Task:* %s
            :1234: *Task Code:* %s
            :alarm_clock: *Due:* %s
            :busts_in_silhouette: *Assigned to:* %s

            :warning: This task is due in about %s!""";

    /**
     * Keep only assignees who opted in to reminders, in their original order
     */
    public List<AssigneeSnapshot> eligibleRecipients(List<AssigneeSnapshot> assignees) {
        if (assignees == null) {
            return List.of();
        }
        return assignees.stream().filter(AssigneeSnapshot::isOptedIn).toList();
    }

    public String compose(TaskSnapshot task, List<AssigneeSnapshot> recipients, int offsetMinutes) {
        var mentions = recipients.stream()
                .map(AssigneeSnapshot::mentionName)
                .collect(Collectors.joining(", "));

        return String.format(TEMPLATE,
                task.getName(),
                task.getCode(),
                DUE_FORMATTER.format(task.getDueAt()),
                mentions,
                describeOffset(offsetMinutes));
    }

    public String describeOffset(int offsetMinutes) {
        if (offsetMinutes == 60) {
            return "1 hour";
        }
        if (offsetMinutes == 30) {
            return "30 minutes";
        }
        return offsetMinutes + " minutes";
    }
}
