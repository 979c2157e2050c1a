package dev.quantumreview.infrastructure.github;

import java.time.Duration;
import java.time.Instant;

/**
 * A GitHub App installation access token and its expiry as reported by GitHub.
 */
public record InstallationToken(long installationId, String token, Instant expiresAt) {

    public InstallationToken {
        if (token == null || token.isBlank()) throw new IllegalArgumentException("token required");
        if (expiresAt == null) throw new IllegalArgumentException("expiresAt required");
    }

    /**
     * True only if the token stays valid for longer than {@code margin} after {@code now}.
     */
    public boolean isUsableAt(Instant now, Duration margin) {
        return expiresAt.isAfter(now.plus(margin));
    }

    public Duration remainingLifetime(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    @Override
    public String toString() {
        return "InstallationToken[installationId=%d, expiresAt=%s]".formatted(installationId, expiresAt);
    }
}
