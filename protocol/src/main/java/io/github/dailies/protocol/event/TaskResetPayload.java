package io.github.dailies.protocol.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/** Data carried by a {@code task_reset} notification: one per frequency per scheduler tick. */
public record TaskResetPayload(
        @JsonProperty("frequency_id") String frequencyId,
        @JsonProperty("frequency_name") String frequencyName,
        @JsonProperty("task_ids") List<String> taskIds,
        @JsonProperty("task_names") List<String> taskNames,
        @JsonProperty("reset_count") int resetCount,
        @JsonProperty("occurred_at") Instant occurredAt
) {
    public TaskResetPayload {
        taskIds = List.copyOf(taskIds);
        taskNames = List.copyOf(taskNames);
    }
}
