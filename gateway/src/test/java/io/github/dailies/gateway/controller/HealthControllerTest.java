package io.github.dailies.gateway.controller;

import io.github.dailies.protocol.api.TimezoneInfo;
import io.github.dailies.runtime.notify.NotificationHub;
import io.github.dailies.runtime.recurrence.RecurrenceEvaluator;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class HealthControllerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock private MongoTemplate mongoTemplate;
    @Mock private NotificationHub hub;

    private HealthController controller;

    @BeforeEach
    void setUp() {
        controller = new HealthController(mongoTemplate, hub, new RecurrenceEvaluator(ZoneId.of("America/Denver")), CLOCK);
        when(hub.getState()).thenReturn(NotificationHub.State.RUNNING);
        when(hub.subscriberCount()).thenReturn(CompletableFuture.completedFuture(3));
        when(mongoTemplate.executeCommand(any(Document.class))).thenReturn(new Document("ok", 1.0));
    }

    @Test
    void healthyWhenDatabaseAndHubUp() {
        ResponseEntity<Map<String, Object>> response = controller.health();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody())
                .containsEntry("status", "UP")
                .containsEntry("hub", "RUNNING")
                .containsEntry("subscribers", 3);
    }

    @Test
    void downWhenDatabaseUnreachable() {
        when(mongoTemplate.executeCommand(any(Document.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertThat(response.getStatusCode().value()).isEqualTo(503);
        assertThat(response.getBody()).containsEntry("database", "DOWN");
    }

    @Test
    void downWhenHubFailed() {
        when(hub.getState()).thenReturn(NotificationHub.State.FAILED);
        when(hub.getFailure()).thenReturn(new IllegalStateException("loop died"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertThat(response.getStatusCode().value()).isEqualTo(503);
        assertThat(response.getBody())
                .containsEntry("status", "DOWN")
                .containsEntry("hub", "FAILED")
                .containsKey("hubError");
    }

    @Test
    void timezoneReportsOffsetAndAbbreviation() {
        TimezoneInfo info = controller.timezone();

        assertThat(info.timezone()).isEqualTo("America/Denver");
        assertThat(info.offset()).isEqualTo("-0700");
        assertThat(info.name()).isEqualTo("MST");
    }
}
