package io.github.dailies.runtime.notify;

import java.time.Duration;

/**
 * Keep-alive contract shared with clients: the server pings every {@code pingInterval} and drops a
 * peer that stays silent for {@code readTimeout}. The ping interval must be shorter than the timeout.
 */
public record SessionSettings(Duration pingInterval, Duration readTimeout, int queueCapacity) {

    public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(54);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    public SessionSettings {
        if (pingInterval == null || pingInterval.isZero() || pingInterval.isNegative()) {
            throw new IllegalArgumentException("pingInterval must be > 0");
        }
        if (readTimeout == null || readTimeout.compareTo(pingInterval) <= 0) {
            throw new IllegalArgumentException("readTimeout must be longer than pingInterval");
        }
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
    }

    public static SessionSettings defaults() {
        return new SessionSettings(DEFAULT_PING_INTERVAL, DEFAULT_READ_TIMEOUT, DEFAULT_QUEUE_CAPACITY);
    }
}
