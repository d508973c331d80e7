package io.github.drompincen.aigov.runtime.trust;

/**
 * Live lookup of a user's permission tier on the host repository.
 */
public interface RepositoryPermissionLookup {

    /** False when no credentials are configured; callers then skip the lookup entirely. */
    boolean isAvailable();

    /**
     * @return the native permission tier, e.g. {@code admin}, {@code write}, {@code read}, {@code none}
     */
    String permissionFor(String owner, String repo, String username);
}
