package io.github.dailies.persistence.document;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TaskDocumentTest {

    @Test
    void createAssignsIdAndTimestamps() {
        Instant now = Instant.parse("2025-01-15T10:00:00Z");

        TaskDocument doc = TaskDocument.create("Water plants", now);

        assertThat(doc.getTaskId()).isNotBlank();
        assertThat(doc.getName()).isEqualTo("Water plants");
        assertThat(doc.isCompleted()).isFalse();
        assertThat(doc.isDeleted()).isFalse();
        assertThat(doc.getFrequencyId()).isNull();
        assertThat(doc.getTagIds()).isEmpty();
        assertThat(doc.getCreatedAt()).isEqualTo(now);
        assertThat(doc.getUpdatedAt()).isEqualTo(now);
    }

    @Test
    void createGivesDistinctIds() {
        Instant now = Instant.now();
        assertThat(TaskDocument.create("a", now).getTaskId())
                .isNotEqualTo(TaskDocument.create("a", now).getTaskId());
    }

    @Test
    void nullTagIdsBecomeEmptyList() {
        TaskDocument doc = new TaskDocument();
        doc.setTagIds(List.of("t1"));
        doc.setTagIds(null);

        assertThat(doc.getTagIds()).isNotNull().isEmpty();
    }
}
