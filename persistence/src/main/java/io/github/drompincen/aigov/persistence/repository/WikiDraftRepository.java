package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.WikiDraftDocument;
import io.github.drompincen.aigov.protocol.api.WikiDraftStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface WikiDraftRepository extends MongoRepository<WikiDraftDocument, String> {
    List<WikiDraftDocument> findByProjectIdAndStatusOrderByProposedAtAsc(String projectId, WikiDraftStatus status);
    List<WikiDraftDocument> findByProjectIdAndPagePathAndStatus(String projectId, String pagePath, WikiDraftStatus status);
}
