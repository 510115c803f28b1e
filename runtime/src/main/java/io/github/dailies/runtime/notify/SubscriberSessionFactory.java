package io.github.dailies.runtime.notify;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.concurrent.ExecutorService;

/** Connection-accept entry point: wraps an established transport and registers it with the hub. */
public class SubscriberSessionFactory {

    private final NotificationHub hub;
    private final ObjectMapper objectMapper;
    private final SessionSettings settings;
    private final ExecutorService writers;

    public SubscriberSessionFactory(NotificationHub hub, ObjectMapper objectMapper,
                                    SessionSettings settings, ExecutorService writers) {
        this.hub = hub;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.writers = writers;
    }

    public SubscriberSession open(SessionTransport transport) {
        SubscriberSession session = new SubscriberSession(hub, transport, objectMapper, settings);
        session.start(writers);
        return session;
    }

    public SessionSettings getSettings() {
        return settings;
    }
}
