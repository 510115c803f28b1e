package io.github.dailies.gateway.websocket;

import io.github.dailies.runtime.notify.SessionTransport;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/** Adapts a Spring {@link WebSocketSession} to the transport a subscriber session writes to. */
class WebSocketSessionTransport implements SessionTransport {

    private final WebSocketSession session;

    WebSocketSessionTransport(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public void sendText(String payload) throws IOException {
        send(new TextMessage(payload));
    }

    @Override
    public void sendPing() throws IOException {
        send(new PingMessage());
    }

    @Override
    public void close() throws IOException {
        if (session.isOpen()) {
            session.close(CloseStatus.GOING_AWAY);
        }
    }

    private void send(WebSocketMessage<?> message) throws IOException {
        try {
            session.sendMessage(message);
        } catch (SessionLimitExceededException e) {
            // send time limit or buffer limit hit
            throw new IOException(e.getMessage(), e);
        }
    }
}
