package io.github.dailies.runtime.task;

import io.github.dailies.persistence.document.FrequencyDocument;
import io.github.dailies.persistence.document.TagDocument;
import io.github.dailies.persistence.document.TaskDocument;
import io.github.dailies.persistence.repository.FrequencyRepository;
import io.github.dailies.persistence.repository.TagRepository;
import io.github.dailies.persistence.repository.TaskRepository;
import io.github.dailies.protocol.api.CreateTaskRequest;
import io.github.dailies.protocol.api.FrequencyDto;
import io.github.dailies.protocol.api.TagDto;
import io.github.dailies.protocol.api.TaskDto;
import io.github.dailies.protocol.api.UpdateTaskRequest;
import io.github.dailies.protocol.ws.NotificationMessage;
import io.github.dailies.protocol.ws.NotificationType;
import io.github.dailies.runtime.error.ConflictException;
import io.github.dailies.runtime.error.NotFoundException;
import io.github.dailies.runtime.error.ValidationException;
import io.github.dailies.runtime.mapping.Dtos;
import io.github.dailies.runtime.notify.EventPublisher;
import io.github.dailies.runtime.recurrence.RecurrenceEvaluator;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

@Service
public class TaskService {

    private final TaskRepository taskRepository;
    private final FrequencyRepository frequencyRepository;
    private final TagRepository tagRepository;
    private final MongoTemplate mongoTemplate;
    private final RecurrenceEvaluator evaluator;
    private final EventPublisher publisher;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, FrequencyRepository frequencyRepository,
                       TagRepository tagRepository, MongoTemplate mongoTemplate,
                       RecurrenceEvaluator evaluator, EventPublisher publisher, Clock clock) {
        this.taskRepository = taskRepository;
        this.frequencyRepository = frequencyRepository;
        this.tagRepository = tagRepository;
        this.mongoTemplate = mongoTemplate;
        this.evaluator = evaluator;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Lists non-deleted tasks.
     *
     * @param completed filter on completion when non-null
     * @param name      case-insensitive substring match when non-blank
     * @param tagIds    tasks must carry all of these tags
     * @param sort      {@code completed}, {@code priority}, {@code name}; anything else sorts by creation time
     */
    public List<TaskDto> list(Boolean completed, String name, List<String> tagIds, String sort) {
        Query query = new Query().addCriteria(Criteria.where("deleted").is(false));
        if (completed != null) {
            query.addCriteria(Criteria.where("completed").is(completed));
        }
        if (name != null && !name.isBlank()) {
            query.addCriteria(Criteria.where("name").regex(Pattern.quote(name.trim()), "i"));
        }
        if (tagIds != null && !tagIds.isEmpty()) {
            query.addCriteria(Criteria.where("tagIds").all(tagIds));
        }
        query.with(sortFor(sort));
        return toDtos(mongoTemplate.find(query, TaskDocument.class));
    }

    public TaskDto get(String id) {
        return toDtos(List.of(find(id))).get(0);
    }

    public TaskDto create(CreateTaskRequest req) {
        if (req == null || req.name() == null || req.name().isBlank()) {
            throw new ValidationException("Task name is required");
        }
        validatePriority(req.priority());

        TaskDocument task = TaskDocument.create(req.name().trim(), clock.instant());
        task.setDescription(req.description());
        task.setPriority(req.priority());
        if (req.frequencyId() != null && !req.frequencyId().isBlank()) {
            task.setFrequencyId(requireFrequency(req.frequencyId()));
        }
        if (req.tagIds() != null) {
            task.setTagIds(requireTags(req.tagIds()));
        }
        task = taskRepository.save(task);

        TaskDto dto = toDtos(List.of(task)).get(0);
        publisher.publish(NotificationMessage.of(NotificationType.TASK_CREATE, "Task created: " + task.getName(), dto));
        return dto;
    }

    /**
     * Applies a partial update. Every update refreshes the modification time, which is also the
     * anchor of the next automatic reset.
     */
    public TaskDto update(String id, UpdateTaskRequest req) {
        TaskDocument task = find(id);
        if (req.name() != null) {
            if (req.name().isBlank()) throw new ValidationException("Task name must not be empty");
            task.setName(req.name().trim());
        }
        if (req.description() != null) {
            task.setDescription(req.description());
        }
        if (req.priority() != null) {
            validatePriority(req.priority());
            task.setPriority(req.priority());
        }
        if (req.frequencyId() != null) {
            task.setFrequencyId(req.frequencyId().isBlank() ? null : requireFrequency(req.frequencyId()));
        }
        if (req.tagIds() != null) {
            task.setTagIds(requireTags(req.tagIds()));
        }
        if (req.completed() != null) {
            task.setCompleted(req.completed());
        }
        task.setUpdatedAt(clock.instant());
        task = saveExisting(task);

        TaskDto dto = toDtos(List.of(task)).get(0);
        publisher.publish(NotificationMessage.of(NotificationType.TASK_UPDATE,
                "Task " + action(req) + ": " + task.getName(), dto));
        return dto;
    }

    /** Soft delete: the task disappears from listings and is never reset again. */
    public void delete(String id) {
        TaskDocument task = find(id);
        task.setDeleted(true);
        task.setUpdatedAt(clock.instant());
        task = saveExisting(task);

        TaskDto dto = toDtos(List.of(task)).get(0);
        publisher.publish(NotificationMessage.of(NotificationType.TASK_DELETE, "Task deleted: " + task.getName(), dto));
    }

    /**
     * Saves a task read earlier in the request. A concurrent write in between (another request, a
     * reset, a tag or frequency detach) bumps the version and this save is rejected.
     */
    private TaskDocument saveExisting(TaskDocument task) {
        try {
            return taskRepository.save(task);
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("Task was modified concurrently, reload and retry", e);
        }
    }

    private TaskDocument find(String id) {
        return taskRepository.findByTaskIdAndDeletedFalse(id)
                .orElseThrow(() -> new NotFoundException("Task not found"));
    }

    private List<TaskDto> toDtos(List<TaskDocument> tasks) {
        Set<String> frequencyIds = new HashSet<>();
        Set<String> tagIds = new HashSet<>();
        for (TaskDocument task : tasks) {
            if (task.getFrequencyId() != null) frequencyIds.add(task.getFrequencyId());
            tagIds.addAll(task.getTagIds());
        }

        Map<String, FrequencyDto> frequencies = new HashMap<>();
        if (!frequencyIds.isEmpty()) {
            for (FrequencyDocument f : frequencyRepository.findAllById(frequencyIds)) {
                frequencies.put(f.getFrequencyId(), Dtos.toDto(f, evaluator.isValid(f.getPeriod())));
            }
        }
        Map<String, TagDto> tags = new HashMap<>();
        if (!tagIds.isEmpty()) {
            for (TagDocument t : tagRepository.findAllById(tagIds)) {
                tags.put(t.getTagId(), Dtos.toDto(t));
            }
        }

        List<TaskDto> result = new ArrayList<>(tasks.size());
        for (TaskDocument task : tasks) {
            List<TagDto> taskTags = task.getTagIds().stream()
                    .map(tags::get)
                    .filter(Objects::nonNull)
                    .toList();
            FrequencyDto frequency = task.getFrequencyId() != null ? frequencies.get(task.getFrequencyId()) : null;
            result.add(Dtos.toDto(task, frequency, taskTags));
        }
        return result;
    }

    private String requireFrequency(String frequencyId) {
        if (!frequencyRepository.existsById(frequencyId)) {
            throw new ValidationException("Frequency not found: " + frequencyId);
        }
        return frequencyId;
    }

    private List<String> requireTags(Collection<String> tagIds) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(tagIds));
        for (String tagId : unique) {
            if (!tagRepository.existsById(tagId)) {
                throw new ValidationException("Tag not found: " + tagId);
            }
        }
        return unique;
    }

    private static void validatePriority(Integer priority) {
        if (priority != null && (priority < 1 || priority > 5)) {
            throw new ValidationException("Priority must be between 1 and 5");
        }
    }

    private static String action(UpdateTaskRequest req) {
        if (req.completed() == null) return "updated";
        return req.completed() ? "completed" : "uncompleted";
    }

    private static Sort sortFor(String sort) {
        if (sort == null) return Sort.by(Sort.Direction.ASC, "createdAt");
        return switch (sort) {
            case "completed" -> Sort.by(Sort.Order.asc("completed"), Sort.Order.asc("priority"));
            case "priority" -> Sort.by(Sort.Direction.ASC, "priority");
            case "name" -> Sort.by(Sort.Direction.ASC, "name");
            default -> Sort.by(Sort.Direction.ASC, "createdAt");
        };
    }
}
