package io.github.dailies.gateway.config;

import io.github.dailies.runtime.reset.ResetScheduler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Starts resetting tasks once the application is ready; disabled with {@code dailies.scheduler.enabled=false}. */
@Component
@ConditionalOnProperty(prefix = "dailies.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ResetSchedulerStarter {

    private final ResetScheduler resetScheduler;

    public ResetSchedulerStarter(ResetScheduler resetScheduler) {
        this.resetScheduler = resetScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        resetScheduler.start();
    }
}
