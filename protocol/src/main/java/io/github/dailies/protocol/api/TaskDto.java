package io.github.dailies.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskDto(
        String id,
        String name,
        String description,
        boolean completed,
        Integer priority,
        @JsonProperty("frequency_id") String frequencyId,
        FrequencyDto frequency,
        List<TagDto> tags,
        boolean deleted,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {}
