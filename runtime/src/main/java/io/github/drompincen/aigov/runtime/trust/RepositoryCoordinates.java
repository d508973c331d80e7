package io.github.drompincen.aigov.runtime.trust;

import java.util.Optional;

public record RepositoryCoordinates(String owner, String repo) {

    private static final String GITHUB_PREFIX = "https://github.com/";

    /**
     * Accepts {@code owner/repo} or {@code https://github.com/owner/repo[.git]}.
     */
    public static Optional<RepositoryCoordinates> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String path = value.trim();
        if (path.startsWith(GITHUB_PREFIX)) path = path.substring(GITHUB_PREFIX.length());
        if (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        if (path.endsWith(".git")) path = path.substring(0, path.length() - 4);
        String[] parts = path.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) return Optional.empty();
        return Optional.of(new RepositoryCoordinates(parts[0], parts[1]));
    }

    public String fullName() {
        return owner + "/" + repo;
    }
}
