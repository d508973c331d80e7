package io.github.drompincen.aigov.runtime.project;

import io.github.drompincen.aigov.protocol.api.ProjectConfig;

/**
 * Resolves the already-validated configuration of a project, once per request.
 */
public interface ProjectConfigResolver {

    /**
     * @throws io.github.drompincen.aigov.runtime.error.ProjectConfigurationException when the project is unknown or its configuration is invalid
     */
    ProjectConfig resolve(String projectId);
}
