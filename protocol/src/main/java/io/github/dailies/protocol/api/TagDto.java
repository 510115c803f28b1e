package io.github.dailies.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TagDto(
        String id,
        String name,
        String color,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {}
