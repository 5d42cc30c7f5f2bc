package com.example.taskreminder.service.reminder;

import com.example.taskreminder.config.MetricsConfig;
import com.example.taskreminder.config.TaskReminderProperties;
import com.example.taskreminder.service.notification.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs one reminder tick: scan, evaluate, deliver, mark sent.
 * <p>
 * Delivery is at-most-once. A reminder that fires is marked sent after
 * its delivery attempt whether or not the notifier accepted the message,
 * so a notifier that fails deterministically cannot leave a reminder
 * stuck or resent on every tick.
 * <p>
 * Flow per tick:
 * 1. Load all unsent reminders on tasks that are not DONE
 * 2. Skip malformed records and those outside their fire window
 * 3. Send one batched message naming every opted-in assignee
 * 4. Mark the reminder sent once the send attempt has returned
 * <p>
 * A store failure aborts the rest of the tick; the next tick starts over.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderDispatchService {

    private final TaskStore taskStore;
    private final Notifier notifier;
    private final DueWindowEvaluator dueWindowEvaluator;
    private final ReminderMessageComposer messageComposer;
    private final MetricsConfig metricsConfig;
    private final TaskReminderProperties properties;

    /**
     * Process every pending reminder against the given instant.
     *
     * @param now           evaluation instant for the whole tick
     * @param stopRequested checked before each reminder; once true the tick ends
     *                      without touching further reminders
     */
    public TickResult runTick(Instant now, BooleanSupplier stopRequested) {
        var timerSample = metricsConfig.startTickTimer();
        var result = TickResult.builder();
        var pollInterval = properties.getPollInterval();

        log.debug("Starting reminder tick at {}", now);

        List<PendingReminder> pending;
        try {
            pending = taskStore.listPendingReminders();
        } catch (RuntimeException e) {
            log.error("Failed to load pending reminders, aborting tick: {}", e.getMessage(), e);
            metricsConfig.recordAbortedTick("store_read");
            metricsConfig.recordTick(timerSample, false);
            return result.aborted(true).build();
        }

        result.scanned(pending.size());
        int fired = 0, delivered = 0, failed = 0, noRecipients = 0, missed = 0, malformed = 0;
        var aborted = false;

        for (var reminder : pending) {
            if (stopRequested.getAsBoolean()) {
                log.info("Stop requested, ending reminder tick early");
                aborted = true;
                break;
            }

            if (isMalformed(reminder)) {
                log.warn("Skipping malformed reminder {} (offset: {}, task: {})",
                        reminder.getReminderId(), reminder.getOffsetMinutes(),
                        reminder.getTask() != null ? reminder.getTask().getCode() : null);
                metricsConfig.recordMalformedReminder();
                malformed++;
                continue;
            }

            var task = reminder.getTask();
            if (!dueWindowEvaluator.isDue(now, task.getDueAt(), reminder.getOffsetMinutes(), pollInterval)) {
                if (dueWindowEvaluator.isMissed(now, task.getDueAt(), reminder.getOffsetMinutes(), pollInterval)) {
                    missed++;
                }
                continue;
            }

            fired++;
            var outcome = deliver(reminder);
            metricsConfig.recordReminderOutcome(outcome.getMetricTag());
            switch (outcome) {
                case DELIVERED -> delivered++;
                case FAILED -> failed++;
                case NO_RECIPIENTS -> noRecipients++;
            }

            try {
                taskStore.markReminderSent(reminder.getReminderId());
            } catch (RuntimeException e) {
                log.error("Failed to mark reminder {} as sent, aborting tick: {}", reminder.getReminderId(), e.getMessage(), e);
                metricsConfig.recordAbortedTick("store_write");
                aborted = true;
                break;
            }
        }

        var tickResult = result
                .fired(fired)
                .delivered(delivered)
                .failed(failed)
                .noRecipients(noRecipients)
                .missed(missed)
                .malformed(malformed)
                .aborted(aborted)
                .build();

        if (fired > 0 || malformed > 0 || aborted) {
            log.info("Reminder tick finished: {} scanned, {} fired ({} delivered, {} failed, {} without recipients), {} malformed{}",
                    pending.size(), fired, delivered, failed, noRecipients, malformed, aborted ? ", aborted" : "");
        } else {
            log.debug("Reminder tick finished: {} scanned, none due, {} with missed windows", pending.size(), missed);
        }

        metricsConfig.recordTick(timerSample, !aborted);
        return tickResult;
    }

    private boolean isMalformed(PendingReminder reminder) {
        var task = reminder.getTask();
        return reminder.getOffsetMinutes() <= 0
                || task == null
                || task.getDueAt() == null
                || task.getChatId() == null;
    }

    private DeliveryOutcome deliver(PendingReminder reminder) {
        var task = reminder.getTask();
        var recipients = messageComposer.eligibleRecipients(task.getAssignees());

        if (recipients.isEmpty()) {
            log.info("No opted-in assignees for task {}, reminder {} consumed without sending", task.getCode(), reminder.getReminderId());
            return DeliveryOutcome.NO_RECIPIENTS;
        }

        var text = messageComposer.compose(task, recipients, reminder.getOffsetMinutes());

        boolean accepted;
        try {
            accepted = notifier.send(task.getChatId(), text);
        } catch (RuntimeException e) {
            log.warn("Notifier threw while sending reminder {} for task {}: {}", reminder.getReminderId(), task.getCode(), e.getMessage());
            accepted = false;
        }

        if (accepted) {
            log.info("Sent {}-minute reminder for task {} to chat {} ({} recipient(s))",
                    reminder.getOffsetMinutes(), task.getCode(), task.getChatId(), recipients.size());
            return DeliveryOutcome.DELIVERED;
        }

        log.warn("Delivery failed for reminder {} of task {}; marking sent anyway", reminder.getReminderId(), task.getCode());
        return DeliveryOutcome.FAILED;
    }
}
