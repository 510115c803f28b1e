package io.github.dailies.protocol.api;

public record UpdateTagRequest(String name, String color) {}
