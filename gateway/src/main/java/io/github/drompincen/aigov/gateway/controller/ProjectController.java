package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.runtime.project.MongoProjectConfigResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

    private final MongoProjectConfigResolver projectConfigResolver;

    public ProjectController(MongoProjectConfigResolver projectConfigResolver) {
        this.projectConfigResolver = projectConfigResolver;
    }

    /** The body is the raw configuration JSON; it is validated before it is stored. */
    @PutMapping(value = "/{id}", consumes = "application/json")
    public ProjectConfig put(@PathVariable String id, @RequestBody String configJson) {
        return projectConfigResolver.save(id, configJson);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProjectConfig> get(@PathVariable String id) {
        return projectConfigResolver.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
