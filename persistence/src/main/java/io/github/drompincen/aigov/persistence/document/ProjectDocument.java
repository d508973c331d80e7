package io.github.drompincen.aigov.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Stored project configuration. The configuration itself is kept as JSON and parsed by the
 * resolver, so schema changes never require a migration of this collection.
 */
@Document(collection = "projects")
public class ProjectDocument {

    @Id
    private String projectId;
    private String name;
    private String repository;
    private String configJson;
    private Instant updatedAt;

    public ProjectDocument() {}

    public String getProjectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRepository() { return repository; }
    public void setRepository(String repository) { this.repository = repository; }

    public String getConfigJson() { return configJson; }
    public void setConfigJson(String configJson) { this.configJson = configJson; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
