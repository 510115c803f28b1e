package io.github.dailies.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.dailies.runtime.notify.NotificationHub;
import io.github.dailies.runtime.notify.SessionSettings;
import io.github.dailies.runtime.notify.SubscriberSessionFactory;
import io.github.dailies.runtime.recurrence.RecurrenceEvaluator;
import io.github.dailies.runtime.reset.MongoResetStore;
import io.github.dailies.runtime.reset.ResetScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Wires the reset scheduler, the notification hub and the WebSocket session plumbing. */
@Configuration
public class CoreConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    RecurrenceEvaluator recurrenceEvaluator(DailiesProperties properties) {
        return new RecurrenceEvaluator(ZoneId.of(properties.timezone()));
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    NotificationHub notificationHub(DailiesProperties properties) {
        return new NotificationHub(properties.hub().commandCapacity());
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService sessionWriters() {
        var threadFactory = new CustomizableThreadFactory("session-writer-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    SubscriberSessionFactory subscriberSessionFactory(NotificationHub hub, ObjectMapper objectMapper,
                                                      ExecutorService sessionWriters,
                                                      DailiesProperties properties) {
        var session = properties.session();
        var settings = new SessionSettings(session.pingInterval(), session.readTimeout(),
                properties.hub().subscriberCapacity());
        return new SubscriberSessionFactory(hub, objectMapper, settings, sessionWriters);
    }

    @Bean(destroyMethod = "stop")
    ResetScheduler resetScheduler(MongoResetStore store, RecurrenceEvaluator evaluator, NotificationHub hub,
                                  ThreadPoolTaskScheduler taskScheduler, DailiesProperties properties,
                                  Clock clock) {
        return new ResetScheduler(store, store, evaluator, hub, taskScheduler,
                properties.scheduler().interval(), clock);
    }
}
