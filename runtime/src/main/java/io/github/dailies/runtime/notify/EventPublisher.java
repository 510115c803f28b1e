package io.github.dailies.runtime.notify;

import io.github.dailies.protocol.ws.NotificationMessage;

/**
 * Fire-and-forget sink for change notifications. Implementations must not block on consumers.
 */
@FunctionalInterface
public interface EventPublisher {

    EventPublisher NOOP = message -> { };

    void publish(NotificationMessage message);
}
