package io.github.dailies.protocol.ws;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum NotificationType {
    TASK_RESET("task_reset"),
    TASK_CREATE("task_create"),
    TASK_UPDATE("task_update"),
    TASK_DELETE("task_delete"),
    TAG_CREATE("tag_create"),
    TAG_UPDATE("tag_update"),
    TAG_DELETE("tag_delete"),
    FREQUENCY_CREATE("frequency_create"),
    FREQUENCY_UPDATE("frequency_update"),
    FREQUENCY_DELETE("frequency_delete");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static NotificationType fromWireName(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown notification type: " + value));
    }
}
