package io.github.dailies.gateway.config;

import io.github.dailies.gateway.websocket.NotificationWebSocketHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WebSocketConfigTest {

    @Mock private NotificationWebSocketHandler handler;
    @Mock private WebSocketHandlerRegistry registry;
    @Mock private WebSocketHandlerRegistration registration;

    @Test
    void registersBroadcastHandlerAtWs_forAnyOrigin() {
        when(registry.addHandler(handler, "/ws")).thenReturn(registration);
        when(registration.setAllowedOrigins(any(String[].class))).thenReturn(registration);

        new WebSocketConfig(handler).registerWebSocketHandlers(registry);

        verify(registry).addHandler(handler, "/ws");
        verify(registration).setAllowedOrigins("*");
        verifyNoMoreInteractions(registry);
    }
}
