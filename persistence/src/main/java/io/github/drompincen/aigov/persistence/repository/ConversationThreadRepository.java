package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.ConversationThreadDocument;
import io.github.drompincen.aigov.protocol.api.ConversationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ConversationThreadRepository extends MongoRepository<ConversationThreadDocument, String> {

    Optional<ConversationThreadDocument> findFirstByProjectIdAndParticipantKeyAndStatus(
            String projectId, String participantKey, ConversationStatus status);

    @Query(value = "{ 'projectId': ?0, 'status': ?1, 'memberKeys': ?2 }", sort = "{ 'updatedAt': -1 }")
    List<ConversationThreadDocument> findByMember(String projectId, ConversationStatus status, String memberKey);

    @Query(value = "{ 'projectId': ?0, 'memberKeys': ?1 }", sort = "{ 'updatedAt': -1 }")
    List<ConversationThreadDocument> findRecentByMember(String projectId, String memberKey, Pageable pageable);

    List<ConversationThreadDocument> findByStatusAndUpdatedAtBefore(ConversationStatus status, Instant before);
}
