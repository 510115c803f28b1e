package io.github.dailies.runtime.reset;

import java.time.Instant;

public interface TaskStateWriter {

    /**
     * Atomically flips a completed task back to incomplete and stamps its modification time.
     *
     * @return false when the task was no longer completed (or no longer exists)
     * @throws RuntimeException when the store rejects the update
     */
    boolean markIncomplete(String taskId, Instant at);
}
