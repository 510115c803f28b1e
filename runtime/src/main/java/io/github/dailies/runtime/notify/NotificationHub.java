package io.github.dailies.runtime.notify;

import io.github.dailies.protocol.ws.NotificationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process broadcast hub.
 *
 * <p>All register, unregister and publish requests are queued and applied by a single loop
 * thread, which is the only code that touches the subscriber set. Publishing never waits for a
 * consumer: each subscriber gets a non-blocking enqueue, and one whose queue is full is closed and
 * dropped.
 */
public class NotificationHub implements EventPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

    public enum State { NEW, RUNNING, CLOSED, FAILED }

    private interface Command { }
    private record Register(Subscriber subscriber) implements Command { }
    private record Unregister(Subscriber subscriber) implements Command { }
    private record Publish(NotificationMessage message) implements Command { }
    private record CountQuery(CompletableFuture<Integer> reply) implements Command { }
    private record Shutdown() implements Command { }

    private final BlockingQueue<Command> commands;
    private final Set<Subscriber> subscribers = new LinkedHashSet<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private volatile Thread loopThread;
    private volatile Throwable failure;

    public NotificationHub(int commandCapacity) {
        this.commands = new ArrayBlockingQueue<>(commandCapacity);
    }

    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Notification hub cannot start from state " + state.get());
        }
        Thread thread = new Thread(this::runLoop, "notification-hub");
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();
        log.info("Notification hub started");
    }

    public State getState() {
        return state.get();
    }

    public Throwable getFailure() {
        return failure;
    }

    public void register(Subscriber subscriber) {
        if (isStopped()) {
            subscriber.close();
            return;
        }
        if (!enqueue(new Register(subscriber))) {
            subscriber.close();
        }
    }

    /** Idempotent; unknown or already removed subscribers are ignored. */
    public void unregister(Subscriber subscriber) {
        if (Thread.currentThread() == loopThread) {
            subscribers.remove(subscriber);
            return;
        }
        if (isStopped()) return;
        enqueue(new Unregister(subscriber));
    }

    @Override
    public void publish(NotificationMessage message) {
        if (isStopped()) {
            log.debug("Hub is {}, dropping {} notification", state.get(), message.type().wireName());
            return;
        }
        if (!commands.offer(new Publish(message))) {
            log.warn("Hub command queue full, dropping {} notification: {}",
                    message.type().wireName(), message.message());
        }
    }

    /** Number of registered subscribers as seen by the loop once it reaches this request. */
    public CompletableFuture<Integer> subscriberCount() {
        CompletableFuture<Integer> reply = new CompletableFuture<>();
        if (isStopped() || !enqueue(new CountQuery(reply))) {
            reply.complete(0);
        }
        return reply;
    }

    @Override
    public void close() {
        State previous = state.getAndUpdate(s -> s == State.FAILED ? s : State.CLOSED);
        if (previous == State.CLOSED || previous == State.FAILED) return;
        if (previous == State.NEW) {
            for (Command pending : commands) {
                if (pending instanceof Register r) r.subscriber().close();
            }
            commands.clear();
            log.info("Notification hub closed before start");
            return;
        }
        try {
            commands.put(new Shutdown());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Thread thread = loopThread;
            if (thread != null) thread.interrupt();
        }
    }

    private boolean isStopped() {
        State s = state.get();
        return s == State.CLOSED || s == State.FAILED;
    }

    private boolean enqueue(Command command) {
        try {
            commands.put(command);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void runLoop() {
        try {
            while (true) {
                Command command = commands.take();
                if (command instanceof Shutdown) {
                    break;
                }
                apply(command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            failure = e;
            state.set(State.FAILED);
            log.error("Notification hub loop failed, live notifications are disabled", e);
            closeAll();
            throw e;
        }
        closeAll();
        log.info("Notification hub stopped");
    }

    /** Closes everything still registered plus any registration queued behind the stop. */
    private void closeAll() {
        List<Subscriber> remaining = new ArrayList<>(subscribers);
        subscribers.clear();
        List<Command> pending = new ArrayList<>();
        commands.drainTo(pending);
        for (Command command : pending) {
            if (command instanceof Register r) remaining.add(r.subscriber());
            else if (command instanceof CountQuery q) q.reply().complete(0);
        }
        for (Subscriber subscriber : remaining) {
            closeQuietly(subscriber);
        }
    }

    private void apply(Command command) {
        if (command instanceof Register r) {
            if (r.subscriber().isClosed()) {
                log.debug("Subscriber {} closed before registration", r.subscriber().getId());
            } else if (subscribers.add(r.subscriber())) {
                log.info("Subscriber {} connected. Total subscribers: {}", r.subscriber().getId(), subscribers.size());
            }
        } else if (command instanceof Unregister u) {
            if (subscribers.remove(u.subscriber())) {
                log.info("Subscriber {} disconnected. Total subscribers: {}", u.subscriber().getId(), subscribers.size());
            }
            u.subscriber().close();
        } else if (command instanceof Publish p) {
            fanOut(p.message());
        } else if (command instanceof CountQuery q) {
            q.reply().complete(subscribers.size());
        }
    }

    private void fanOut(NotificationMessage message) {
        if (subscribers.isEmpty()) {
            log.debug("No subscribers connected, {} not delivered", message.type().wireName());
            return;
        }
        int delivered = 0;
        List<Subscriber> lagging = new ArrayList<>();
        for (Subscriber subscriber : subscribers) {
            if (subscriber.offer(message)) {
                delivered++;
            } else {
                lagging.add(subscriber);
            }
        }
        // close callbacks may unregister re-entrantly, so the set is not iterated past this point
        for (Subscriber subscriber : lagging) {
            subscribers.remove(subscriber);
            log.warn("Subscriber {} is not keeping up, disconnecting it", subscriber.getId());
            closeQuietly(subscriber);
        }
        log.debug("{} delivered to {} subscribers: {}", message.type().wireName(), delivered, message.message());
    }

    private void closeQuietly(Subscriber subscriber) {
        try {
            subscriber.close();
        } catch (RuntimeException e) {
            log.warn("Error closing subscriber {}", subscriber.getId(), e);
        }
    }
}
