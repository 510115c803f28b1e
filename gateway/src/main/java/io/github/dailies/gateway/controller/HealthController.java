package io.github.dailies.gateway.controller;

import io.github.dailies.protocol.api.TimezoneInfo;
import io.github.dailies.runtime.notify.NotificationHub;
import io.github.dailies.runtime.recurrence.RecurrenceEvaluator;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private static final DateTimeFormatter OFFSET = DateTimeFormatter.ofPattern("xx", Locale.ROOT);
    private static final DateTimeFormatter ZONE_NAME = DateTimeFormatter.ofPattern("zzz", Locale.ROOT);

    private final MongoTemplate mongoTemplate;
    private final NotificationHub hub;
    private final RecurrenceEvaluator evaluator;
    private final Clock clock;

    public HealthController(MongoTemplate mongoTemplate, NotificationHub hub,
                            RecurrenceEvaluator evaluator, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.hub = hub;
        this.evaluator = evaluator;
        this.clock = clock;
    }

    /** UP only when the database answers a ping and the hub loop is running. */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = pingDatabase();
        boolean hubUp = hub.getState() == NotificationHub.State.RUNNING;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp && hubUp ? "UP" : "DOWN");
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("hub", hub.getState().name());
        body.put("subscribers", hub.subscriberCount().completeOnTimeout(-1, 1, TimeUnit.SECONDS).join());
        if (hub.getFailure() != null) {
            body.put("hubError", hub.getFailure().toString());
        }
        HttpStatus status = databaseUp && hubUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(body);
    }

    /** Zone used for frequencies without their own timezone, e.g. {@code {"UTC", "+0000", "UTC"}}. */
    @GetMapping("/api/timezone")
    public TimezoneInfo timezone() {
        ZoneId zone = evaluator.getDefaultZone();
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        return new TimezoneInfo(zone.getId(), now.format(OFFSET), now.format(ZONE_NAME));
    }

    private boolean pingDatabase() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
            return true;
        } catch (RuntimeException e) {
            log.warn("Database ping failed: {}", e.getMessage());
            return false;
        }
    }
}
