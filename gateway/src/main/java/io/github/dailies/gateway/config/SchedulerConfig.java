package io.github.dailies.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    @Bean
    ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("reset-scheduler-");
        // an in-flight tick is not awaited on shutdown
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
