package io.github.dailies.runtime.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.dailies.protocol.ws.NotificationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges one {@link Subscriber} to its transport.
 *
 * <p>The outbound loop runs on its own thread and waits on the subscriber queue or the ping
 * timer. The inbound direction is driven by the transport owner, which reports received frames
 * through {@link #markAlive()} and closure through {@link #close(String)}. Teardown runs once no
 * matter how many directions fail.
 */
public class SubscriberSession {

    private static final Logger log = LoggerFactory.getLogger(SubscriberSession.class);

    private final NotificationHub hub;
    private final SessionTransport transport;
    private final ObjectMapper objectMapper;
    private final SessionSettings settings;
    private final Subscriber subscriber;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile long lastSeenNanos = System.nanoTime();
    private volatile Future<?> writer;
    private volatile Thread writerThread;

    SubscriberSession(NotificationHub hub, SessionTransport transport, ObjectMapper objectMapper,
                      SessionSettings settings) {
        this.hub = hub;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.subscriber = new Subscriber(transport.id(), settings.queueCapacity(), this::onSubscriberClosed);
    }

    void start(ExecutorService writers) {
        hub.register(subscriber);
        writer = writers.submit(this::writeLoop);
        log.debug("Session {} opened", transport.id());
    }

    public String getId() {
        return transport.id();
    }

    public Subscriber getSubscriber() {
        return subscriber;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Any inbound frame, pong included, proves the peer is still there. */
    public void markAlive() {
        lastSeenNanos = System.nanoTime();
    }

    /** Idempotent teardown: unregisters, stops the outbound loop and closes the transport exactly once. */
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) return;
        log.debug("Closing session {}: {}", transport.id(), reason);

        hub.unregister(subscriber);
        subscriber.close();
        stopWriter();
        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Error closing transport for session {}: {}", transport.id(), e.getMessage());
        }
    }

    private void onSubscriberClosed() {
        // Called from the hub loop on eviction or shutdown; the writer thread performs teardown.
        if (closed.get()) return;
        Future<?> w = writer;
        if (w != null && w.cancel(true) && writerThread == null) {
            // cancelled before the outbound loop ever ran
            close("disconnected by hub");
        }
    }

    private void stopWriter() {
        Future<?> w = writer;
        if (w != null && Thread.currentThread() != writerThread) {
            w.cancel(true);
        }
    }

    private void writeLoop() {
        writerThread = Thread.currentThread();
        String reason = "writer stopped";
        boolean interrupted = false;
        long readTimeoutNanos = settings.readTimeout().toNanos();
        long nextPing = System.nanoTime() + settings.pingInterval().toNanos();
        try {
            while (!closed.get()) {
                if (subscriber.isClosed()) {
                    reason = "disconnected by hub";
                    break;
                }
                long now = System.nanoTime();
                long deadline = lastSeenNanos + readTimeoutNanos;
                if (now - deadline > 0) {
                    reason = "no response within " + settings.readTimeout().toMillis() + "ms";
                    break;
                }
                if (now - nextPing >= 0) {
                    transport.sendPing();
                    nextPing = now + settings.pingInterval().toNanos();
                    continue;
                }
                // wake for whichever comes first: the next ping or the read deadline
                long waitNanos = Math.min(nextPing - now, deadline - now + 1);
                NotificationMessage message = subscriber.poll(Duration.ofNanos(waitNanos));
                if (message != null) {
                    transport.sendText(serialize(message));
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            reason = subscriber.isClosed() ? "disconnected by hub" : "interrupted";
        } catch (IOException e) {
            reason = "write failed: " + e.getMessage();
            log.debug("Write to session {} failed", transport.id(), e);
        } finally {
            close(reason);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private String serialize(NotificationMessage message) throws IOException {
        return objectMapper.writeValueAsString(message);
    }
}
