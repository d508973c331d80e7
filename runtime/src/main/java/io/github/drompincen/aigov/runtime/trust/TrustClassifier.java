package io.github.drompincen.aigov.runtime.trust;

import io.github.drompincen.aigov.protocol.api.ApiKeyGrant;
import io.github.drompincen.aigov.protocol.api.GovernanceRequest;
import io.github.drompincen.aigov.protocol.api.ProjectConfig;
import io.github.drompincen.aigov.protocol.api.RequestSource;
import io.github.drompincen.aigov.protocol.api.TrustLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Assigns a trust level to an inbound request. Lookup failures never raise trust: they fall back
 * to {@code contributor}, which is never cached.
 */
@Service
public class TrustClassifier {

    private static final Logger log = LoggerFactory.getLogger(TrustClassifier.class);

    private final RepositoryPermissionLookup permissionLookup;
    private final PermissionCache cache;

    @Autowired
    public TrustClassifier(RepositoryPermissionLookup permissionLookup, Clock clock,
                           @Value("${aigov.trust.cache-ttl:PT5M}") Duration cacheTtl) {
        this(permissionLookup, new PermissionCache(clock, cacheTtl));
    }

    TrustClassifier(RepositoryPermissionLookup permissionLookup, PermissionCache cache) {
        this.permissionLookup = permissionLookup;
        this.cache = cache;
    }

    public TrustLevel classify(GovernanceRequest request, ProjectConfig project) {
        RequestSource source = request.source();
        return switch (source.channel()) {
            case GITHUB_WEBHOOK -> classifyWebhook(request, project);
            case PUBLIC_API -> TrustLevel.ANONYMOUS;
            case CONTRIBUTOR_API -> classifyContributorApi(source, project);
            case ADMIN_CLI -> TrustLevel.ELEVATED;
        };
    }

    public void clearCache() {
        cache.clear();
    }

    private TrustLevel classifyWebhook(GovernanceRequest request, ProjectConfig project) {
        RequestSource source = request.source();
        if (!source.hasIdentity()) return TrustLevel.ANONYMOUS;
        String identity = source.identity();

        Optional<TrustLevel> cached = cache.get(request.project(), identity);
        if (cached.isPresent()) return cached.get();

        if (!permissionLookup.isAvailable()) return TrustLevel.CONTRIBUTOR;

        String repository = project != null && project.repository() != null ? project.repository() : request.project();
        Optional<RepositoryCoordinates> coordinates = RepositoryCoordinates.parse(repository);
        if (coordinates.isEmpty()) return TrustLevel.CONTRIBUTOR;

        try {
            String permission = permissionLookup.permissionFor(
                    coordinates.get().owner(), coordinates.get().repo(), identity);
            TrustLevel trust = mapPermission(permission, project);
            cache.put(request.project(), identity, trust);
            return trust;
        } catch (Exception e) {
            log.warn("Failed to get repository permission for {} on {}: {}", identity, repository, e.getMessage());
            return TrustLevel.CONTRIBUTOR;
        }
    }

    private TrustLevel classifyContributorApi(RequestSource source, ProjectConfig project) {
        if (!source.hasIdentity()) return TrustLevel.ANONYMOUS;
        if (project != null) {
            for (ApiKeyGrant grant : project.trust().apiKeys()) {
                if (source.identity().equals(grant.name()) && grant.trust() != null) {
                    return grant.trust();
                }
            }
        }
        return TrustLevel.CONTRIBUTOR;
    }

    static TrustLevel mapPermission(String permission, ProjectConfig project) {
        String tier = permission != null ? permission.toLowerCase() : "none";
        if (project != null) {
            TrustLevel override = project.trust().githubRoles().get(tier);
            if (override != null) return override;
        }
        return switch (tier) {
            case "admin", "maintain" -> TrustLevel.ELEVATED;
            case "write" -> TrustLevel.AUTHORIZED;
            case "triage", "read" -> TrustLevel.CONTRIBUTOR;
            default -> TrustLevel.ANONYMOUS;
        };
    }
}
