package io.github.drompincen.aigov.runtime.project;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.aigov.persistence.document.ProjectDocument;
import io.github.drompincen.aigov.persistence.repository.ProjectRepository;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.runtime.error.ProjectConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Project configurations stored as JSON in the {@code projects} collection. Parsing happens on
 * both write and read, so an invalid configuration, including an unknown constraint type, is
 * rejected rather than stored.
 */
@Service
public class MongoProjectConfigResolver implements ProjectConfigResolver {

    private static final Logger log = LoggerFactory.getLogger(MongoProjectConfigResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ProjectRepository projectRepository;
    private final Clock clock;

    public MongoProjectConfigResolver(ProjectRepository projectRepository, Clock clock) {
        this.projectRepository = projectRepository;
        this.clock = clock;
    }

    @Override
    public ProjectConfig resolve(String projectId) {
        ProjectDocument doc = projectRepository.findById(projectId)
                .orElseThrow(() -> new ProjectConfigurationException("Unknown project: " + projectId));
        return withId(parse(doc.getConfigJson()), projectId);
    }

    public Optional<ProjectConfig> find(String projectId) {
        return projectRepository.findById(projectId).map(doc -> withId(parse(doc.getConfigJson()), projectId));
    }

    /**
     * Validates and stores a configuration given as JSON.
     */
    public ProjectConfig save(String projectId, String configJson) {
        ProjectConfig config = withId(parse(configJson), projectId);
        ProjectDocument doc = projectRepository.findById(projectId).orElseGet(ProjectDocument::new);
        doc.setProjectId(projectId);
        doc.setName(config.name());
        doc.setRepository(config.repository());
        doc.setConfigJson(write(config));
        doc.setUpdatedAt(clock.instant());
        projectRepository.save(doc);
        log.info("Stored configuration of project {} with {} roles", projectId, config.roles().size());
        return config;
    }

    public static ProjectConfig parse(String json) {
        if (json == null || json.isBlank()) {
            throw new ProjectConfigurationException("Project configuration is empty");
        }
        try {
            return MAPPER.readValue(json, ProjectConfig.class);
        } catch (JsonProcessingException e) {
            throw new ProjectConfigurationException("Invalid project configuration: " + e.getOriginalMessage(), e);
        }
    }

    private static String write(ProjectConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new ProjectConfigurationException("Cannot serialize project configuration " + config.id(), e);
        }
    }

    private static ProjectConfig withId(ProjectConfig config, String projectId) {
        if (projectId.equals(config.id())) return config;
        return new ProjectConfig(projectId, config.name(), config.repository(), config.constitution(),
                config.roles(), config.routing(), config.toolServers(), config.trust());
    }
}
