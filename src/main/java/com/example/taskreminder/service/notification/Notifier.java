package com.example.taskreminder.service.notification;

/**
 * Outbound messaging transport used for reminders.
 * <p>
 * Best-effort: a {@code true} result only means the transport accepted
 * the message. Callers do not retry.
 */
public interface Notifier {

    /**
     * @return true if the message was accepted; failure is reported either
     * as {@code false} or as a runtime exception
     */
    boolean send(String chatId, String text);
}
