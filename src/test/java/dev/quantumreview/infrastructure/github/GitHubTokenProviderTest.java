package dev.quantumreview.infrastructure.github;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.quantumreview.config.GitHubProperties;
import dev.quantumreview.exception.TokenAcquisitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class GitHubTokenProviderTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final long INSTALLATION = 7L;
    private static final String TOKEN_PATH = "/app/installations/7/access_tokens";

    private final MapTokenCache cache = new MapTokenCache();
    private GitHubTokenProvider provider;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        GitHubProperties properties = new GitHubProperties(
                99L, TestKeys.pkcs8Pem(), "secret", wmInfo.getHttpBaseUrl(), null, null, null, null);
        WebClient webClient = WebClient.builder().baseUrl(wmInfo.getHttpBaseUrl()).build();
        provider = new GitHubTokenProvider(new GitHubAppJwtFactory(properties, clock), cache, webClient, clock, properties);
    }

    @Test
    @DisplayName("exchanges an app JWT on a cache miss and caches the result")
    void exchangesOnMiss() {
        stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(okJson(tokenJson("ghs_fresh", NOW.plus(Duration.ofHours(1))))));

        String token = provider.getInstallationToken(INSTALLATION);

        assertThat(token).isEqualTo("ghs_fresh");
        verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)).withHeader("Authorization", matching("Bearer .+")));
        assertThat(cache.stored.get(INSTALLATION).token()).isEqualTo("ghs_fresh");
        assertThat(cache.ttls.get(INSTALLATION)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("serves a cached token that outlives the refresh margin")
    void servesCachedToken() {
        cache.stored.put(INSTALLATION, new InstallationToken(INSTALLATION, "ghs_cached", NOW.plus(Duration.ofMinutes(30))));

        assertThat(provider.getInstallationToken(INSTALLATION)).isEqualTo("ghs_cached");
        verify(0, postRequestedFor(urlEqualTo(TOKEN_PATH)));
    }

    @Test
    @DisplayName("refetches a cached token that expires within the 5 minute margin")
    void refetchesNearExpiry() {
        cache.stored.put(INSTALLATION, new InstallationToken(INSTALLATION, "ghs_stale", NOW.plus(Duration.ofMinutes(2))));
        stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(okJson(tokenJson("ghs_new", NOW.plus(Duration.ofHours(1))))));

        String token = provider.getInstallationToken(INSTALLATION);

        assertThat(token).isEqualTo("ghs_new");
        verify(1, postRequestedFor(urlEqualTo(TOKEN_PATH)));
    }

    @Test
    @DisplayName("surfaces a refused exchange as TokenAcquisitionException")
    void failsOnRefusal() {
        stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(unauthorized()));

        assertThatThrownBy(() -> provider.getInstallationToken(INSTALLATION))
                .isInstanceOf(TokenAcquisitionException.class)
                .hasMessageContaining("401")
                .extracting(e -> ((TokenAcquisitionException) e).getInstallationId())
                .isEqualTo(INSTALLATION);
        assertThat(cache.stored).isEmpty();
    }

    @Test
    @DisplayName("an unsigned app JWT is reported as an app-level failure, not tied to an installation")
    void appJwtFailureIsAppLevel(WireMockRuntimeInfo wmInfo) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        GitHubProperties unkeyed = new GitHubProperties(
                99L, null, "secret", wmInfo.getHttpBaseUrl(), null, null, null, null);
        GitHubTokenProvider keyless = new GitHubTokenProvider(new GitHubAppJwtFactory(unkeyed, clock), cache,
                WebClient.builder().baseUrl(wmInfo.getHttpBaseUrl()).build(), clock, unkeyed);

        assertThatThrownBy(keyless::getAppJwt)
                .isInstanceOf(TokenAcquisitionException.class)
                .hasMessageContaining("private key is not configured")
                .satisfies(e -> {
                    assertThat(((TokenAcquisitionException) e).isAppLevel()).isTrue();
                    assertThat(((TokenAcquisitionException) e).getInstallationId()).isNull();
                });
    }

    @Test
    @DisplayName("never returns an empty token")
    void failsOnEmptyBody() {
        stubFor(post(urlEqualTo(TOKEN_PATH)).willReturn(okJson("{\"token\":\"\",\"expires_at\":\"2026-03-01T13:00:00Z\"}")));

        assertThatThrownBy(() -> provider.getInstallationToken(INSTALLATION))
                .isInstanceOf(TokenAcquisitionException.class);
    }

    private static String tokenJson(String token, Instant expiresAt) {
        return """
                {"token": "%s", "expires_at": "%s", "permissions": {"contents": "read"}}
                """.formatted(token, expiresAt);
    }

    static class MapTokenCache implements InstallationTokenCache {
        final Map<Long, InstallationToken> stored = new HashMap<>();
        final Map<Long, Duration> ttls = new HashMap<>();

        @Override
        public Optional<InstallationToken> get(long installationId) {
            return Optional.ofNullable(stored.get(installationId));
        }

        @Override
        public void put(InstallationToken token, Duration ttl) {
            stored.put(token.installationId(), token);
            ttls.put(token.installationId(), ttl);
        }
    }
}
