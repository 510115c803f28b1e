package io.github.dailies.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Document(collection = "tasks")
@CompoundIndex(name = "completed_frequency", def = "{'completed': 1, 'frequencyId': 1}")
public class TaskDocument {

    @Id
    private String taskId;
    private String name;
    private String description;
    private boolean completed;
    private Integer priority;
    @Indexed
    private String frequencyId;
    private List<String> tagIds = new ArrayList<>();
    private boolean deleted;
    private Instant createdAt;
    private Instant updatedAt;
    @Version
    private Long version;

    public TaskDocument() {}

    /** New, incomplete task with a freshly assigned id. */
    public static TaskDocument create(String name, Instant now) {
        TaskDocument doc = new TaskDocument();
        doc.setTaskId(UUID.randomUUID().toString());
        doc.setName(name);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }

    public String getFrequencyId() { return frequencyId; }
    public void setFrequencyId(String frequencyId) { this.frequencyId = frequencyId; }

    public List<String> getTagIds() { return tagIds; }
    public void setTagIds(List<String> tagIds) { this.tagIds = tagIds != null ? tagIds : new ArrayList<>(); }

    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    /** Last modification instant; the reset scheduler measures recurrence boundaries from here. */
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    /** Bumped on every write, including the reset scheduler's conditional updates. */
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
