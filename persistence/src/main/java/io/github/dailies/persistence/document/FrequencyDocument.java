package io.github.dailies.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.UUID;

@Document(collection = "frequencies")
public class FrequencyDocument {

    @Id
    private String frequencyId;
    @Indexed(unique = true)
    private String name;
    private String period;
    private String timezone;
    private Instant createdAt;
    private Instant updatedAt;

    public FrequencyDocument() {}

    public static FrequencyDocument create(String name, String period, String timezone, Instant now) {
        FrequencyDocument doc = new FrequencyDocument();
        doc.setFrequencyId(UUID.randomUUID().toString());
        doc.setName(name);
        doc.setPeriod(period);
        doc.setTimezone(timezone);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    public String getFrequencyId() { return frequencyId; }
    public void setFrequencyId(String frequencyId) { this.frequencyId = frequencyId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    /** Five-field cron expression: minute hour day-of-month month day-of-week. */
    public String getPeriod() { return period; }
    public void setPeriod(String period) { this.period = period; }

    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
