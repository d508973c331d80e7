package io.github.drompincen.aigov.runtime.trust;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RepositoryCoordinatesTest {

    @Test
    void parsesPlainAndUrlForms() {
        assertThat(RepositoryCoordinates.parse("acme/widgets")).hasValueSatisfying(c -> {
            assertThat(c.owner()).isEqualTo("acme");
            assertThat(c.repo()).isEqualTo("widgets");
        });
        assertThat(RepositoryCoordinates.parse("https://github.com/acme/widgets.git"))
                .hasValueSatisfying(c -> assertThat(c.fullName()).isEqualTo("acme/widgets"));
    }

    @Test
    void rejectsGarbage() {
        assertThat(RepositoryCoordinates.parse(null)).isEmpty();
        assertThat(RepositoryCoordinates.parse("widgets")).isEmpty();
        assertThat(RepositoryCoordinates.parse("a/b/c")).isEmpty();
    }
}
