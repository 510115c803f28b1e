package io.github.dailies.runtime.reset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.dailies.protocol.ws.NotificationMessage;
import io.github.dailies.protocol.ws.NotificationType;
import io.github.dailies.runtime.notify.NotificationHub;
import io.github.dailies.runtime.notify.SessionSettings;
import io.github.dailies.runtime.notify.SessionTransport;
import io.github.dailies.runtime.notify.SubscriberSessionFactory;
import io.github.dailies.runtime.recurrence.RecurrenceEvaluator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/** Scheduler tick through a live hub to a connected session's wire frames. */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ResetNotificationFlowTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");
    private static final Instant TWO_DAYS_AGO = NOW.minus(2, ChronoUnit.DAYS);

    @Mock private ResetCandidateSource candidateSource;
    @Mock private TaskStateWriter stateWriter;
    @Mock private TaskScheduler taskScheduler;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private NotificationHub hub;
    private ExecutorService writers;
    private ResetScheduler scheduler;

    @BeforeEach
    void setUp() {
        hub = new NotificationHub(64);
        hub.start();
        writers = Executors.newCachedThreadPool();
        scheduler = new ResetScheduler(candidateSource, stateWriter, new RecurrenceEvaluator(ZoneOffset.UTC),
                hub, taskScheduler, Duration.ofMinutes(1), Clock.fixed(NOW, ZoneOffset.UTC));
        when(stateWriter.markIncomplete(any(), any())).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        hub.close();
        writers.shutdownNow();
    }

    @Test
    void oneTick_resettingTwoTasksOfOneFrequency_deliversExactlyOneTaskReset() throws Exception {
        RecordingTransport transport = new RecordingTransport();
        new SubscriberSessionFactory(hub, objectMapper,
                new SessionSettings(Duration.ofSeconds(5), Duration.ofSeconds(10), 16), writers)
                .open(transport);
        await().atMost(Duration.ofSeconds(2))
                .until(() -> hub.subscriberCount().get(1, TimeUnit.SECONDS) == 1);
        when(candidateSource.loadResettableCandidates()).thenReturn(List.of(
                new ResetCandidate("t1", "Water plants", TWO_DAYS_AGO, "f-daily", "Daily", "0 0 * * *", null),
                new ResetCandidate("t2", "Stretch", TWO_DAYS_AGO, "f-daily", "Daily", "0 0 * * *", null)));

        TickReport report = scheduler.tick();
        // anything published after the tick is queued behind its events
        hub.publish(NotificationMessage.of(NotificationType.TASK_UPDATE, "marker", null));

        assertThat(report.reset()).isEqualTo(2);
        await().atMost(Duration.ofSeconds(3)).until(() -> transport.texts.size() >= 2);
        List<JsonNode> frames = transport.texts.stream().map(this::readTree).toList();
        assertThat(frames).hasSize(2);
        JsonNode reset = frames.get(0);
        assertThat(reset.get("type").asText()).isEqualTo("task_reset");
        assertThat(reset.get("message").asText()).isEqualTo("Daily tasks have been reset");
        assertThat(reset.get("data").get("reset_count").asInt()).isEqualTo(2);
        assertThat(reset.get("data").get("task_ids").toString()).isEqualTo("[\"t1\",\"t2\"]");
        assertThat(frames.get(1).get("message").asText()).isEqualTo("marker");
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new AssertionError("not JSON: " + json, e);
        }
    }

    private static final class RecordingTransport implements SessionTransport {
        private final List<String> texts = new CopyOnWriteArrayList<>();

        @Override
        public String id() {
            return "ws-flow";
        }

        @Override
        public void sendText(String payload) {
            texts.add(payload);
        }

        @Override
        public void sendPing() {
        }

        @Override
        public void close() {
        }
    }
}
