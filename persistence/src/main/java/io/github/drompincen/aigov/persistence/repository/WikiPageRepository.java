package io.github.drompincen.aigov.persistence.repository;

import io.github.drompincen.aigov.persistence.document.WikiPageDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;
import java.util.Optional;

public interface WikiPageRepository extends MongoRepository<WikiPageDocument, String> {

    Optional<WikiPageDocument> findByProjectIdAndPath(String projectId, String path);

    List<WikiPageDocument> findByProjectIdOrderByPathAsc(String projectId);

    /** Case-insensitive match on title or content; callers pass an already-quoted pattern. */
    @Query("{ 'projectId': ?0, '$or': [ { 'title': { '$regex': ?1, '$options': 'i' } }, { 'content': { '$regex': ?1, '$options': 'i' } } ] }")
    List<WikiPageDocument> search(String projectId, String pattern);
}
