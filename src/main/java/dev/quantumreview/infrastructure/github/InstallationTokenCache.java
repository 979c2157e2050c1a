package dev.quantumreview.infrastructure.github;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared token cache keyed by installation id. Implementations live in a store shared by
 * every web and worker process.
 */
public interface InstallationTokenCache {

    Optional<InstallationToken> get(long installationId);

    void put(InstallationToken token, Duration ttl);
}
