package io.github.dailies.protocol.api;

public record UpdateFrequencyRequest(String name, String period, String timezone) {}
