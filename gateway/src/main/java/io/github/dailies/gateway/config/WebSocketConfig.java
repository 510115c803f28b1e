package io.github.dailies.gateway.config;

import io.github.dailies.gateway.websocket.NotificationWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the broadcast endpoint at {@code /ws}.
 *
 * <p>The channel is one-way: every connection receives each hub notification as a JSON text frame
 * and nothing the client sends is interpreted. The server pings on the configured interval and
 * drops a peer that stays silent past the read timeout; inbound text frames are capped at
 * {@code dailies.session.max-message-bytes}. Any origin may connect.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final NotificationWebSocketHandler handler;

    public WebSocketConfig(NotificationWebSocketHandler handler) {
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws").setAllowedOrigins("*");
    }
}
