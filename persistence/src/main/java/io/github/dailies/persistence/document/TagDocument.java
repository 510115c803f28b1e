package io.github.dailies.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.UUID;

@Document(collection = "tags")
public class TagDocument {

    @Id
    private String tagId;
    @Indexed(unique = true)
    private String name;
    private String color;
    private Instant createdAt;
    private Instant updatedAt;

    public TagDocument() {}

    public static TagDocument create(String name, String color, Instant now) {
        TagDocument doc = new TagDocument();
        doc.setTagId(UUID.randomUUID().toString());
        doc.setName(name);
        doc.setColor(color);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    public String getTagId() { return tagId; }
    public void setTagId(String tagId) { this.tagId = tagId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
