package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.ProjectDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProjectRepository extends MongoRepository<ProjectDocument, String> {
}
