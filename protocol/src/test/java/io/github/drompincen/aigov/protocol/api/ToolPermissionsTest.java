package io.github.drompincen.aigov.protocol.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ToolPermissionsTest {

    @Test
    void allowAllAdmitsEveryTool() {
        ToolPermissions permissions = ToolPermissions.allowAll();

        assertThat(permissions.allowed()).isEmpty();
        assertThat(permissions.denied()).isEmpty();
        assertThat(permissions.isAllowed("anything")).isTrue();
    }

    @Test
    void denyWinsOverAllow() {
        ToolPermissions permissions = new ToolPermissions(List.of("a"), List.of("a"));

        assertThat(permissions.isDenied("a")).isTrue();
        assertThat(permissions.isAllowed("a")).isFalse();
    }

    @Test
    void nonEmptyAllowListExcludesUnlistedTools() {
        ToolPermissions permissions = new ToolPermissions(List.of("search_decisions"), List.of());

        assertThat(permissions.isAllowed("search_decisions")).isTrue();
        assertThat(permissions.isAllowed("merge_pull_request")).isFalse();
    }

    @Test
    void nullListsBecomeEmpty() {
        ToolPermissions permissions = new ToolPermissions(null, null);

        assertThat(permissions.allowed()).isEmpty();
        assertThat(permissions.denied()).isEmpty();
    }
}
