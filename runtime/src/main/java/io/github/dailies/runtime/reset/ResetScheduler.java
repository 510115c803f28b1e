package io.github.dailies.runtime.reset;

import io.github.dailies.protocol.event.TaskResetPayload;
import io.github.dailies.protocol.ws.NotificationMessage;
import io.github.dailies.protocol.ws.NotificationType;
import io.github.dailies.runtime.notify.EventPublisher;
import io.github.dailies.runtime.recurrence.InvalidRecurrenceException;
import io.github.dailies.runtime.recurrence.RecurrenceEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically flips completed recurring tasks back to incomplete once their frequency's next
 * boundary after the last modification has passed.
 *
 * <p>{@link #start()} while running is a caller error and throws. {@link #stop()} prevents further
 * ticks but does not wait for a tick already in progress; each reset is a single-document update,
 * so an interrupted pass never leaves a task half-written.
 */
public class ResetScheduler {

    private static final Logger log = LoggerFactory.getLogger(ResetScheduler.class);

    public enum State { STOPPED, RUNNING }

    private final ResetCandidateSource candidateSource;
    private final TaskStateWriter stateWriter;
    private final RecurrenceEvaluator evaluator;
    private final EventPublisher publisher;
    private final TaskScheduler taskScheduler;
    private final Duration interval;
    private final Clock clock;

    private ScheduledFuture<?> driver;

    public ResetScheduler(ResetCandidateSource candidateSource, TaskStateWriter stateWriter,
                          RecurrenceEvaluator evaluator, EventPublisher publisher,
                          TaskScheduler taskScheduler, Duration interval, Clock clock) {
        this.candidateSource = candidateSource;
        this.stateWriter = stateWriter;
        this.evaluator = evaluator;
        this.publisher = publisher != null ? publisher : EventPublisher.NOOP;
        this.taskScheduler = taskScheduler;
        this.interval = interval;
        this.clock = clock;
    }

    public synchronized void start() {
        if (driver != null) {
            throw new IllegalStateException("Reset scheduler is already running");
        }
        driver = taskScheduler.scheduleAtFixedRate(this::runTick, interval);
        log.info("Task reset scheduler started (interval {})", interval);
    }

    public synchronized void stop() {
        if (driver == null) return;
        driver.cancel(false);
        driver = null;
        log.info("Task reset scheduler stopped");
    }

    public synchronized State getState() {
        return driver != null ? State.RUNNING : State.STOPPED;
    }

    private void runTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // an exception escaping a fixed-rate task would cancel every later run
            log.error("Unexpected error during task reset tick", e);
        }
    }

    /** One evaluation-and-reset pass against a single snapshot of "now". */
    public TickReport tick() {
        Instant now = clock.instant();

        List<ResetCandidate> candidates;
        try {
            candidates = candidateSource.loadResettableCandidates();
        } catch (RuntimeException e) {
            log.error("Error fetching tasks for reset check, retrying next tick", e);
            return TickReport.abortedTick();
        }

        Map<String, ResetBatch> batches = new LinkedHashMap<>();
        int skipped = 0;
        int failed = 0;
        int reset = 0;

        for (ResetCandidate candidate : candidates) {
            boolean due;
            try {
                due = evaluator.shouldReset(candidate.expression(), candidate.timezone(),
                        candidate.lastModified(), now);
            } catch (InvalidRecurrenceException e) {
                log.warn("Skipping task '{}' ({}): {}", candidate.taskName(), candidate.taskId(), e.getMessage());
                skipped++;
                continue;
            }
            if (!due) continue;

            try {
                if (!stateWriter.markIncomplete(candidate.taskId(), now)) {
                    log.debug("Task {} was no longer completed, nothing to reset", candidate.taskId());
                    continue;
                }
            } catch (RuntimeException e) {
                log.error("Error resetting task '{}' ({})", candidate.taskName(), candidate.taskId(), e);
                failed++;
                continue;
            }

            reset++;
            batches.computeIfAbsent(candidate.frequencyId(), id -> new ResetBatch(id, candidate.frequencyName()))
                    .add(candidate);
            log.info("Reset task '{}' (frequency: {})", candidate.taskName(), candidate.frequencyName());
        }

        for (ResetBatch batch : batches.values()) {
            publisher.publish(NotificationMessage.of(NotificationType.TASK_RESET,
                    batch.frequencyName + " tasks have been reset", batch.toPayload(now), now));
        }

        if (reset > 0 || skipped > 0 || failed > 0) {
            log.info("Reset tick: {} candidates, {} reset, {} skipped, {} failed",
                    candidates.size(), reset, skipped, failed);
        }
        return new TickReport(candidates.size(), reset, skipped, failed, false);
    }

    private static final class ResetBatch {
        private final String frequencyId;
        private final String frequencyName;
        private final List<String> taskIds = new ArrayList<>();
        private final List<String> taskNames = new ArrayList<>();

        ResetBatch(String frequencyId, String frequencyName) {
            this.frequencyId = frequencyId;
            this.frequencyName = frequencyName;
        }

        void add(ResetCandidate candidate) {
            taskIds.add(candidate.taskId());
            taskNames.add(candidate.taskName());
        }

        TaskResetPayload toPayload(Instant at) {
            return new TaskResetPayload(frequencyId, frequencyName, taskIds, taskNames, taskIds.size(), at);
        }
    }
}
