package io.github.dailies.protocol.api;

public record CreateFrequencyRequest(String name, String period, String timezone) {}
