package io.github.dailies.runtime.notify;

import io.github.dailies.protocol.ws.NotificationMessage;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live consumer of hub notifications, backed by a bounded outbound queue.
 * The hub only ever calls {@link #offer} and {@link #close}; the owning session drains the queue.
 */
public class Subscriber {

    private final String id;
    private final BlockingQueue<NotificationMessage> outbound;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Subscriber(String id, int capacity, Runnable onClose) {
        this.id = id;
        this.outbound = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose != null ? onClose : () -> { };
    }

    public Subscriber(String id, int capacity) {
        this(id, capacity, null);
    }

    public String getId() {
        return id;
    }

    /** Non-blocking enqueue; false when the queue is full or the subscriber is closed. */
    public boolean offer(NotificationMessage message) {
        return !closed.get() && outbound.offer(message);
    }

    /** Waits up to {@code timeout} for the next message; null on timeout. */
    public NotificationMessage poll(Duration timeout) throws InterruptedException {
        return outbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int pending() {
        return outbound.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Marks the subscriber dead and signals its owner once. Never blocks. */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.run();
        }
    }

    @Override
    public String toString() {
        return "Subscriber[" + id + "]";
    }
}
