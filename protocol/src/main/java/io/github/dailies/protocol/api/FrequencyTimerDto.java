package io.github.dailies.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FrequencyTimerDto(
        String id,
        String name,
        String period,
        @JsonProperty("next_reset") Instant nextReset,
        @JsonProperty("time_until_reset") String timeUntilReset
) {}
