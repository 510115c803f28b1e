package io.github.dailies.runtime.tag;

import io.github.dailies.persistence.document.TagDocument;
import io.github.dailies.persistence.document.TaskDocument;
import io.github.dailies.persistence.repository.TagRepository;
import io.github.dailies.protocol.api.CreateTagRequest;
import io.github.dailies.protocol.api.TagDto;
import io.github.dailies.protocol.api.UpdateTagRequest;
import io.github.dailies.protocol.ws.NotificationMessage;
import io.github.dailies.protocol.ws.NotificationType;
import io.github.dailies.runtime.error.ConflictException;
import io.github.dailies.runtime.error.NotFoundException;
import io.github.dailies.runtime.error.ValidationException;
import io.github.dailies.runtime.mapping.Dtos;
import io.github.dailies.runtime.notify.EventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class TagService {

    static final String DEFAULT_COLOR = "#6c757d";

    private final TagRepository tagRepository;
    private final MongoTemplate mongoTemplate;
    private final EventPublisher publisher;
    private final Clock clock;

    public TagService(TagRepository tagRepository, MongoTemplate mongoTemplate,
                      EventPublisher publisher, Clock clock) {
        this.tagRepository = tagRepository;
        this.mongoTemplate = mongoTemplate;
        this.publisher = publisher;
        this.clock = clock;
    }

    public List<TagDto> list(String name) {
        List<TagDocument> tags = name == null || name.isBlank()
                ? tagRepository.findAllByOrderByNameAsc()
                : tagRepository.findByNameContainingIgnoreCaseOrderByNameAsc(name.trim());
        return tags.stream().map(Dtos::toDto).toList();
    }

    public TagDto get(String id) {
        return Dtos.toDto(find(id));
    }

    public TagDto create(CreateTagRequest req) {
        if (req == null || req.name() == null || req.name().isBlank()) {
            throw new ValidationException("Tag name is required");
        }
        String name = req.name().trim();
        if (tagRepository.existsByName(name)) {
            throw new ConflictException("Tag with this name already exists");
        }
        String color = req.color() != null && !req.color().isBlank() ? req.color().trim() : DEFAULT_COLOR;
        TagDocument tag = save(TagDocument.create(name, color, clock.instant()));

        TagDto dto = Dtos.toDto(tag);
        publisher.publish(NotificationMessage.of(NotificationType.TAG_CREATE, "Tag created: " + name, dto));
        return dto;
    }

    public TagDto update(String id, UpdateTagRequest req) {
        TagDocument tag = find(id);
        if (req.name() != null) {
            String name = req.name().trim();
            if (name.isEmpty()) throw new ValidationException("Tag name must not be empty");
            if (!name.equals(tag.getName()) && tagRepository.existsByName(name)) {
                throw new ConflictException("Tag with this name already exists");
            }
            tag.setName(name);
        }
        if (req.color() != null && !req.color().isBlank()) {
            tag.setColor(req.color().trim());
        }
        tag.setUpdatedAt(clock.instant());
        tag = save(tag);

        TagDto dto = Dtos.toDto(tag);
        publisher.publish(NotificationMessage.of(NotificationType.TAG_UPDATE, "Tag updated: " + tag.getName(), dto));
        return dto;
    }

    /** Deletes the tag and detaches it from every task carrying it. */
    public void delete(String id) {
        TagDocument tag = find(id);
        Instant now = clock.instant();
        mongoTemplate.updateMulti(
                new Query(Criteria.where("tagIds").is(id)),
                new Update().pull("tagIds", id).set("updatedAt", now).inc("version", 1),
                TaskDocument.class);
        tagRepository.delete(tag);

        publisher.publish(NotificationMessage.of(NotificationType.TAG_DELETE,
                "Tag deleted: " + tag.getName(), Dtos.toDto(tag)));
    }

    private TagDocument find(String id) {
        return tagRepository.findById(id).orElseThrow(() -> new NotFoundException("Tag not found"));
    }

    private TagDocument save(TagDocument tag) {
        try {
            return tagRepository.save(tag);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Tag with this name already exists", e);
        }
    }
}
