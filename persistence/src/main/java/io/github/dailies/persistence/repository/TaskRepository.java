package io.github.dailies.persistence.repository;

import io.github.dailies.persistence.document.TaskDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TaskRepository extends MongoRepository<TaskDocument, String> {
    Optional<TaskDocument> findByTaskIdAndDeletedFalse(String taskId);
    List<TaskDocument> findByCompletedTrueAndFrequencyIdNotNullAndDeletedFalse();
}
