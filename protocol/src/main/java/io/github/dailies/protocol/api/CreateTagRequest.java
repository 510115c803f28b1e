package io.github.dailies.protocol.api;

public record CreateTagRequest(String name, String color) {}
