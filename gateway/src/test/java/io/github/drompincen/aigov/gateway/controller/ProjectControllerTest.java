package io.github.drompincen.aigov.gateway.controller;

import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.runtime.project.MongoProjectConfigResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProjectControllerTest {

    private static final String CONFIG = """
            {"name": "Widgets", "repository": "acme/widgets",
             "roles": [{"name": "reception", "acceptsTrust": ["anonymous", "contributor"]}]}
            """;

    @Mock private MongoProjectConfigResolver resolver;

    private ProjectController controller;

    @BeforeEach
    void setUp() {
        controller = new ProjectController(resolver);
    }

    @Test
    void putStoresConfiguration() {
        ProjectConfig parsed = MongoProjectConfigResolver.parse(CONFIG);
        when(resolver.save("widgets", CONFIG)).thenReturn(parsed);

        ProjectConfig result = controller.put("widgets", CONFIG);

        assertThat(result.name()).isEqualTo("Widgets");
        verify(resolver).save("widgets", CONFIG);
    }

    @Test
    void getReturns404ForUnknownProject() {
        when(resolver.find("ghost")).thenReturn(Optional.empty());
        ResponseEntity<ProjectConfig> response = controller.get("ghost");
        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void getReturnsConfiguration() {
        when(resolver.find("widgets")).thenReturn(Optional.of(MongoProjectConfigResolver.parse(CONFIG)));
        ResponseEntity<ProjectConfig> response = controller.get("widgets");
        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().repository()).isEqualTo("acme/widgets");
    }
}
