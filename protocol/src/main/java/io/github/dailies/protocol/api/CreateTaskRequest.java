package io.github.dailies.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CreateTaskRequest(
        String name,
        String description,
        Integer priority,
        @JsonProperty("frequency_id") String frequencyId,
        @JsonProperty("tag_ids") List<String> tagIds
) {}
