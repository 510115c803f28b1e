package io.github.dailies.runtime.notify;

import java.io.IOException;

/** The wire a {@link SubscriberSession} writes to, typically one WebSocket connection. */
public interface SessionTransport {

    String id();

    void sendText(String payload) throws IOException;

    /** Keep-alive ping; the peer is expected to answer with a pong. */
    void sendPing() throws IOException;

    void close() throws IOException;
}
