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
import io.github.dailies.runtime.notify.EventPublisher;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TagServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");

    @Mock private TagRepository tagRepository;
    @Mock private MongoTemplate mongoTemplate;
    @Mock private EventPublisher publisher;
    @Captor private ArgumentCaptor<NotificationMessage> messageCaptor;
    @Captor private ArgumentCaptor<Update> updateCaptor;

    private TagService service;

    @BeforeEach
    void setUp() {
        service = new TagService(tagRepository, mongoTemplate, publisher, Clock.fixed(NOW, ZoneOffset.UTC));
        when(tagRepository.save(any(TagDocument.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void create_defaultsColor_publishesTagCreate() {
        TagDto dto = service.create(new CreateTagRequest("health", null));

        assertThat(dto.color()).isEqualTo(TagService.DEFAULT_COLOR);
        verify(publisher).publish(messageCaptor.capture());
        assertThat(messageCaptor.getValue().type()).isEqualTo(NotificationType.TAG_CREATE);
        assertThat(messageCaptor.getValue().message()).isEqualTo("Tag created: health");
    }

    @Test
    void create_duplicateName_conflicts() {
        when(tagRepository.existsByName("health")).thenReturn(true);

        assertThatThrownBy(() -> service.create(new CreateTagRequest("health", "#fff")))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Tag with this name already exists");
    }

    @Test
    void create_blankName_rejected() {
        assertThatThrownBy(() -> service.create(new CreateTagRequest("", null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void update_changesColor_publishesTagUpdate() {
        TagDocument tag = TagDocument.create("health", "#fff", NOW.minusSeconds(60));
        when(tagRepository.findById(tag.getTagId())).thenReturn(Optional.of(tag));

        TagDto dto = service.update(tag.getTagId(), new UpdateTagRequest(null, "#000"));

        assertThat(dto.color()).isEqualTo("#000");
        assertThat(dto.updatedAt()).isEqualTo(NOW);
        verify(publisher).publish(messageCaptor.capture());
        assertThat(messageCaptor.getValue().type()).isEqualTo(NotificationType.TAG_UPDATE);
    }

    @Test
    void delete_pullsTagFromTasks() {
        TagDocument tag = TagDocument.create("health", "#fff", NOW);
        when(tagRepository.findById(tag.getTagId())).thenReturn(Optional.of(tag));

        service.delete(tag.getTagId());

        verify(mongoTemplate).updateMulti(any(Query.class), updateCaptor.capture(), eq(TaskDocument.class));
        Document pull = (Document) updateCaptor.getValue().getUpdateObject().get("$pull");
        assertThat(pull.get("tagIds")).isEqualTo(tag.getTagId());
        assertThat(updateCaptor.getValue().getUpdateObject()).containsKey("$inc");
        verify(tagRepository).delete(tag);
        verify(publisher).publish(messageCaptor.capture());
        assertThat(messageCaptor.getValue().type()).isEqualTo(NotificationType.TAG_DELETE);
    }

    @Test
    void list_filtersByName() {
        when(tagRepository.findByNameContainingIgnoreCaseOrderByNameAsc("hea"))
                .thenReturn(List.of(TagDocument.create("health", "#fff", NOW)));

        assertThat(service.list(" hea ")).extracting(TagDto::name).containsExactly("health");
        verify(tagRepository, never()).findAllByOrderByNameAsc();
    }

    @Test
    void get_unknown_notFound() {
        when(tagRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get("missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Tag not found");
    }
}
