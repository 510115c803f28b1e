package io.github.dailies.protocol.api;

/** Scheduler timezone as reported by {@code GET /api/timezone}, e.g. {@code America/Denver, -0600, MDT}. */
public record TimezoneInfo(String timezone, String offset, String name) {}
