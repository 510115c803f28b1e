package io.github.dailies.gateway.websocket;

import io.github.dailies.gateway.config.DailiesProperties;
import io.github.dailies.runtime.notify.SubscriberSession;
import io.github.dailies.runtime.notify.SubscriberSessionFactory;
import jakarta.websocket.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@code /ws} endpoint. Every connection becomes a {@link SubscriberSession} that receives all hub
 * notifications. Clients are not expected to send anything; any inbound frame only refreshes
 * liveness.
 */
@Component
public class NotificationWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(NotificationWebSocketHandler.class);

    static final int SEND_BUFFER_LIMIT = 512 * 1024;
    /** Tomcat user property bounding each blocking send, in milliseconds. */
    static final String BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final SubscriberSessionFactory sessionFactory;
    private final DailiesProperties.Session settings;
    private final Map<String, SubscriberSession> sessions = new ConcurrentHashMap<>();

    public NotificationWebSocketHandler(SubscriberSessionFactory sessionFactory, DailiesProperties properties) {
        this.sessionFactory = sessionFactory;
        this.settings = properties.session();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) {
        ws.setTextMessageSizeLimit(settings.maxMessageBytes());
        // the decorator's time limit only applies to senders queued behind a stuck send; the
        // container timeout is what bounds the single writer's own send
        applyBlockingSendTimeout(ws);
        var decorated = new ConcurrentWebSocketSessionDecorator(ws,
                (int) settings.writeTimeout().toMillis(), SEND_BUFFER_LIMIT);
        SubscriberSession session = sessionFactory.open(new WebSocketSessionTransport(decorated));
        sessions.put(ws.getId(), session);
        log.info("WebSocket {} connected from {}", ws.getId(), ws.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        touch(ws);
    }

    @Override
    protected void handlePongMessage(WebSocketSession ws, PongMessage message) {
        touch(ws);
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        log.debug("WebSocket {} transport error: {}", ws.getId(), exception.getMessage());
        SubscriberSession session = sessions.remove(ws.getId());
        if (session != null) {
            session.close("transport error");
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
        SubscriberSession session = sessions.remove(ws.getId());
        if (session != null) {
            session.close("closed by peer (" + status.getCode() + ")");
        }
        log.info("WebSocket {} disconnected ({})", ws.getId(), status.getCode());
    }

    int openSessions() {
        return sessions.size();
    }

    private void applyBlockingSendTimeout(WebSocketSession ws) {
        if (!(ws instanceof NativeWebSocketSession nativeSession)) return;
        Session container = nativeSession.getNativeSession(Session.class);
        if (container != null) {
            container.getUserProperties().put(BLOCKING_SEND_TIMEOUT, settings.writeTimeout().toMillis());
        } else {
            log.debug("WebSocket {} has no container session, send timeout not applied", ws.getId());
        }
    }

    private void touch(WebSocketSession ws) {
        SubscriberSession session = sessions.get(ws.getId());
        if (session != null) {
            session.markAlive();
        }
    }
}
