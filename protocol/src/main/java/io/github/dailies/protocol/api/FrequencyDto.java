package io.github.dailies.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A named recurrence schedule. {@code valid} reports whether {@code period} parses as a
 * five-field cron expression; invalid periods are stored but never trigger a reset.
 */
public record FrequencyDto(
        String id,
        String name,
        String period,
        String timezone,
        boolean valid,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {}
