package io.github.dailies.runtime.reset;

import io.github.dailies.persistence.document.FrequencyDocument;
import io.github.dailies.persistence.document.TaskDocument;
import io.github.dailies.persistence.repository.FrequencyRepository;
import io.github.dailies.persistence.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class MongoResetStore implements ResetCandidateSource, TaskStateWriter {

    private static final Logger log = LoggerFactory.getLogger(MongoResetStore.class);

    private final TaskRepository taskRepository;
    private final FrequencyRepository frequencyRepository;
    private final MongoTemplate mongoTemplate;

    public MongoResetStore(TaskRepository taskRepository, FrequencyRepository frequencyRepository,
                           MongoTemplate mongoTemplate) {
        this.taskRepository = taskRepository;
        this.frequencyRepository = frequencyRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<ResetCandidate> loadResettableCandidates() {
        List<TaskDocument> tasks = taskRepository.findByCompletedTrueAndFrequencyIdNotNullAndDeletedFalse();
        if (tasks.isEmpty()) return List.of();

        Set<String> frequencyIds = tasks.stream().map(TaskDocument::getFrequencyId).collect(Collectors.toSet());
        Map<String, FrequencyDocument> frequencies = new HashMap<>();
        frequencyRepository.findAllById(frequencyIds)
                .forEach(f -> frequencies.put(f.getFrequencyId(), f));

        List<ResetCandidate> candidates = new ArrayList<>(tasks.size());
        for (TaskDocument task : tasks) {
            FrequencyDocument frequency = frequencies.get(task.getFrequencyId());
            if (frequency == null) {
                log.warn("Task {} references missing frequency {}", task.getTaskId(), task.getFrequencyId());
                continue;
            }
            Instant lastModified = task.getUpdatedAt() != null ? task.getUpdatedAt() : task.getCreatedAt();
            if (lastModified == null) {
                log.warn("Task {} has no modification time, cannot evaluate its reset", task.getTaskId());
                continue;
            }
            candidates.add(new ResetCandidate(
                    task.getTaskId(),
                    task.getName(),
                    lastModified,
                    frequency.getFrequencyId(),
                    frequency.getName(),
                    frequency.getPeriod(),
                    frequency.getTimezone()));
        }
        return candidates;
    }

    @Override
    public boolean markIncomplete(String taskId, Instant at) {
        Query query = new Query()
                .addCriteria(Criteria.where("_id").is(taskId))
                .addCriteria(Criteria.where("completed").is(true))
                .addCriteria(Criteria.where("deleted").is(false));
        Update update = new Update()
                .set("completed", false)
                .set("updatedAt", at)
                .inc("version", 1);
        return mongoTemplate.updateFirst(query, update, TaskDocument.class).getModifiedCount() > 0;
    }
}
