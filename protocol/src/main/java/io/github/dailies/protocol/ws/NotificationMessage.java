package io.github.dailies.protocol.ws;

import java.time.Instant;

/**
 * Envelope pushed to every live subscriber.
 * Serializes as {@code {"type", "message", "data", "timestamp"}} with an ISO-8601 timestamp.
 */
public record NotificationMessage(
        NotificationType type,
        String message,
        Object data,
        Instant timestamp
) {
    public static NotificationMessage of(NotificationType type, String message, Object data) {
        return new NotificationMessage(type, message, data, Instant.now());
    }

    public static NotificationMessage of(NotificationType type, String message, Object data, Instant timestamp) {
        return new NotificationMessage(type, message, data, timestamp);
    }
}
