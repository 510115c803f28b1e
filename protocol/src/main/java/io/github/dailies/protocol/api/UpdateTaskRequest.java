package io.github.dailies.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Partial update: null fields are left unchanged. An empty {@code frequency_id} detaches the
 * task from its frequency.
 */
public record UpdateTaskRequest(
        String name,
        String description,
        Boolean completed,
        Integer priority,
        @JsonProperty("frequency_id") String frequencyId,
        @JsonProperty("tag_ids") List<String> tagIds
) {}
