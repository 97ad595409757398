package com.agentboard.core.model;

import java.time.LocalDateTime;

/**
 * An entry in the shared notification ledger.
 *
 * @param to        recipient agent
 * @param from      sending agent
 * @param message   single-line message text
 * @param time      when the notification was queued (minute precision)
 * @param taskId    related task, nullable
 * @param link      workspace-relative link to the related record, nullable
 * @param delivered when the recipient acknowledged it; null while pending
 */
public record Notification(
    String to,
    String from,
    String message,
    LocalDateTime time,
    String taskId,
    String link,
    LocalDateTime delivered
) {
    public static Notification pending(String to, String from, String message,
                                       LocalDateTime time, String taskId, String link) {
        return new Notification(to, from, message, time, taskId, link, null);
    }

    public boolean isDelivered() {
        return delivered != null;
    }

    public Notification withDelivered(LocalDateTime deliveredAt) {
        return new Notification(to, from, message, time, taskId, link, deliveredAt);
    }
}
