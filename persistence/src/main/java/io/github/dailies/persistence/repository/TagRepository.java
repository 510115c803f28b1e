package io.github.dailies.persistence.repository;

import io.github.dailies.persistence.document.TagDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TagRepository extends MongoRepository<TagDocument, String> {
    boolean existsByName(String name);
    List<TagDocument> findAllByOrderByNameAsc();
    List<TagDocument> findByNameContainingIgnoreCaseOrderByNameAsc(String name);
}
