package io.github.dailies.persistence.repository;

import io.github.dailies.persistence.document.FrequencyDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface FrequencyRepository extends MongoRepository<FrequencyDocument, String> {
    boolean existsByName(String name);
    List<FrequencyDocument> findAllByOrderByNameAsc();
    List<FrequencyDocument> findByNameContainingIgnoreCaseOrderByNameAsc(String name);
}
