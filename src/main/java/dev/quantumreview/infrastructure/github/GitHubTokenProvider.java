package dev.quantumreview.infrastructure.github;

import dev.quantumreview.config.GitHubProperties;
import dev.quantumreview.dto.github.AccessTokenResponse;
import dev.quantumreview.exception.TokenAcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Credential cache for GitHub App installation tokens.
 *
 * <p>A cached token is served only while it stays valid for longer than the refresh margin
 * (5 minutes by default). Otherwise a fresh app JWT is minted and exchanged at
 * {@code POST /app/installations/{id}/access_tokens}, and the result is cached for its
 * remaining lifetime.
 *
 * <p>Concurrent misses for the same installation each mint their own token; there is no
 * single-flight lock.
 */
@Component
public class GitHubTokenProvider {
    private static final Logger log = LoggerFactory.getLogger(GitHubTokenProvider.class);

    private final GitHubAppJwtFactory jwtFactory;
    private final InstallationTokenCache cache;
    private final WebClient webClient;
    private final Clock clock;
    private final Duration refreshMargin;

    public GitHubTokenProvider(GitHubAppJwtFactory jwtFactory,
                               InstallationTokenCache cache,
                               @Qualifier("gitHubWebClient") WebClient webClient,
                               Clock clock,
                               GitHubProperties properties) {
        this.jwtFactory = jwtFactory;
        this.cache = cache;
        this.webClient = webClient;
        this.clock = clock;
        this.refreshMargin = properties.tokenRefreshMargin();
    }

    /**
     * @throws TokenAcquisitionException if the JWT cannot be signed or GitHub refuses the exchange
     */
    public String getInstallationToken(long installationId) {
        Optional<InstallationToken> cached = cache.get(installationId);
        if (cached.isPresent() && cached.get().isUsableAt(clock.instant(), refreshMargin)) {
            log.debug("Using cached installation token for installation {}", installationId);
            return cached.get().token();
        }

        InstallationToken fresh = exchange(installationId);
        Duration ttl = fresh.remainingLifetime(clock.instant());
        if (!ttl.isZero()) {
            cache.put(fresh, ttl);
        }
        log.info("Obtained installation token for installation {} (expires {})", installationId, fresh.expiresAt());
        return fresh.token();
    }

    /**
     * App-level credential for calls under {@code /app}.
     */
    public String getAppJwt() {
        try {
            return jwtFactory.createAppJwt();
        } catch (IllegalStateException e) {
            throw TokenAcquisitionException.appLevel("Cannot sign GitHub App JWT: " + e.getMessage(), e);
        }
    }

    private InstallationToken exchange(long installationId) {
        String jwt;
        try {
            jwt = jwtFactory.createAppJwt();
        } catch (IllegalStateException e) {
            throw new TokenAcquisitionException(installationId,
                    "Cannot sign GitHub App JWT for installation " + installationId, e);
        }
        log.debug("Exchanging app JWT for installation token, installation {}", installationId);

        AccessTokenResponse response;
        try {
            response = webClient.post()
                    .uri("/app/installations/{installationId}/access_tokens", installationId)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt)
                    .retrieve()
                    .bodyToMono(AccessTokenResponse.class)
                    .block();
        } catch (WebClientResponseException e) {
            throw new TokenAcquisitionException(installationId,
                    "GitHub refused token exchange for installation %d with status %d"
                            .formatted(installationId, e.getStatusCode().value()), e);
        } catch (RuntimeException e) {
            throw new TokenAcquisitionException(installationId,
                    "Token exchange failed for installation " + installationId, e);
        }

        if (response == null || response.token() == null || response.token().isBlank()
                || response.expiresAt() == null) {
            throw new TokenAcquisitionException(installationId,
                    "GitHub returned no token for installation " + installationId);
        }
        try {
            return new InstallationToken(installationId, response.token(), Instant.parse(response.expiresAt()));
        } catch (DateTimeParseException e) {
            throw new TokenAcquisitionException(installationId,
                    "Unparseable expires_at '%s' for installation %d".formatted(response.expiresAt(), installationId), e);
        }
    }
}
