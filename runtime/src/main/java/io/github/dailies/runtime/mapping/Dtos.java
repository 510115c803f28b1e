package io.github.dailies.runtime.mapping;

import io.github.dailies.persistence.document.FrequencyDocument;
import io.github.dailies.persistence.document.TagDocument;
import io.github.dailies.persistence.document.TaskDocument;
import io.github.dailies.protocol.api.FrequencyDto;
import io.github.dailies.protocol.api.TagDto;
import io.github.dailies.protocol.api.TaskDto;

import java.util.List;

/** Document to wire DTO conversions shared by the services. */
public final class Dtos {

    private Dtos() {}

    public static TagDto toDto(TagDocument tag) {
        return new TagDto(tag.getTagId(), tag.getName(), tag.getColor(), tag.getCreatedAt(), tag.getUpdatedAt());
    }

    public static FrequencyDto toDto(FrequencyDocument frequency, boolean valid) {
        return new FrequencyDto(
                frequency.getFrequencyId(),
                frequency.getName(),
                frequency.getPeriod(),
                frequency.getTimezone(),
                valid,
                frequency.getCreatedAt(),
                frequency.getUpdatedAt());
    }

    public static TaskDto toDto(TaskDocument task, FrequencyDto frequency, List<TagDto> tags) {
        return new TaskDto(
                task.getTaskId(),
                task.getName(),
                task.getDescription(),
                task.isCompleted(),
                task.getPriority(),
                task.getFrequencyId(),
                frequency,
                tags,
                task.isDeleted(),
                task.getCreatedAt(),
                task.getUpdatedAt());
    }
}
