package io.github.drompincen.aigov.runtime.trust;

import io.github.drompincen.aigov.protocol.api.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TrustClassifierTest {

    @Mock
    private RepositoryPermissionLookup lookup;

    private TrustClassifier classifier;
    private ProjectConfig project;

    @BeforeEach
    void setUp() {
        when(lookup.isAvailable()).thenReturn(true);
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        classifier = new TrustClassifier(lookup, new PermissionCache(clock, Duration.ofMinutes(5)));
        project = new ProjectConfig("proj", "Project", "acme/widgets", null, List.of(), Map.of(), List.of(), null);
    }

    private GovernanceRequest request(Channel channel, String identity) {
        return GovernanceRequest.create(RequestSource.of(channel, identity), "proj", "hello", Map.of());
    }

    @Test
    void webhookWithoutIdentityIsAnonymous() {
        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, null), project)).isEqualTo(TrustLevel.ANONYMOUS);
        verify(lookup, never()).permissionFor(anyString(), anyString(), anyString());
    }

    @Test
    void webhookMapsRepositoryPermission() {
        when(lookup.permissionFor("acme", "widgets", "alice")).thenReturn("write");
        when(lookup.permissionFor("acme", "widgets", "bob")).thenReturn("admin");
        when(lookup.permissionFor("acme", "widgets", "carol")).thenReturn("read");
        when(lookup.permissionFor("acme", "widgets", "dave")).thenReturn("none");

        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), project)).isEqualTo(TrustLevel.AUTHORIZED);
        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "bob"), project)).isEqualTo(TrustLevel.ELEVATED);
        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "carol"), project)).isEqualTo(TrustLevel.CONTRIBUTOR);
        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "dave"), project)).isEqualTo(TrustLevel.ANONYMOUS);
    }

    @Test
    void lookupResultIsCached() {
        when(lookup.permissionFor("acme", "widgets", "alice")).thenReturn("write");

        classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), project);
        classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), project);

        verify(lookup, times(1)).permissionFor("acme", "widgets", "alice");
    }

    @Test
    void lookupFailureFallsBackToContributorAndIsNotCached() {
        when(lookup.permissionFor(anyString(), anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), project)).isEqualTo(TrustLevel.CONTRIBUTOR);
        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), project)).isEqualTo(TrustLevel.CONTRIBUTOR);

        verify(lookup, times(2)).permissionFor("acme", "widgets", "alice");
    }

    @Test
    void unavailableLookupGivesContributor() {
        when(lookup.isAvailable()).thenReturn(false);

        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), project)).isEqualTo(TrustLevel.CONTRIBUTOR);
        verify(lookup, never()).permissionFor(anyString(), anyString(), anyString());
    }

    @Test
    void unparseableRepositoryGivesContributor() {
        ProjectConfig odd = new ProjectConfig("proj", "Project", "not a repo", null, List.of(), Map.of(), List.of(), null);

        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), odd)).isEqualTo(TrustLevel.CONTRIBUTOR);
    }

    @Test
    void projectRoleOverrideWins() {
        ProjectConfig strict = new ProjectConfig("proj", "Project", "https://github.com/acme/widgets.git", null,
                List.of(), Map.of(), List.of(),
                new TrustSettings(Map.of("write", TrustLevel.CONTRIBUTOR), List.of()));
        when(lookup.permissionFor("acme", "widgets", "alice")).thenReturn("write");

        assertThat(classifier.classify(request(Channel.GITHUB_WEBHOOK, "alice"), strict)).isEqualTo(TrustLevel.CONTRIBUTOR);
    }

    @Test
    void fixedChannels() {
        assertThat(classifier.classify(request(Channel.PUBLIC_API, "alice"), project)).isEqualTo(TrustLevel.ANONYMOUS);
        assertThat(classifier.classify(request(Channel.ADMIN_CLI, null), project)).isEqualTo(TrustLevel.ELEVATED);
    }

    @Test
    void contributorApiUsesProjectApiKeys() {
        ProjectConfig withKeys = new ProjectConfig("proj", "Project", "acme/widgets", null, List.of(), Map.of(),
                List.of(), new TrustSettings(Map.of(), List.of(new ApiKeyGrant("ci-bot", TrustLevel.AUTHORIZED))));

        assertThat(classifier.classify(request(Channel.CONTRIBUTOR_API, "ci-bot"), withKeys)).isEqualTo(TrustLevel.AUTHORIZED);
        assertThat(classifier.classify(request(Channel.CONTRIBUTOR_API, "someone"), withKeys)).isEqualTo(TrustLevel.CONTRIBUTOR);
        assertThat(classifier.classify(request(Channel.CONTRIBUTOR_API, null), withKeys)).isEqualTo(TrustLevel.ANONYMOUS);
    }
}
