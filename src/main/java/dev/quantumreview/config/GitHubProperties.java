package dev.quantumreview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * GitHub App credentials and API client settings.
 *
 * <p>{@code privateKey} is the PEM content itself (PKCS#1 or PKCS#8); literal {@code \n}
 * sequences from environment variables are accepted.
 */
@ConfigurationProperties(prefix = "quantumreview.github")
public record GitHubProperties(long appId,
                               String privateKey,
                               String webhookSecret,
                               String apiBaseUrl,
                               Duration appJwtTtl,
                               Duration tokenRefreshMargin,
                               Duration connectTimeout,
                               Duration responseTimeout) {
    public GitHubProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) apiBaseUrl = "https://api.github.com";
        if (appJwtTtl == null) appJwtTtl = Duration.ofMinutes(10);
        if (appJwtTtl.compareTo(Duration.ofMinutes(10)) > 0) appJwtTtl = Duration.ofMinutes(10);
        if (tokenRefreshMargin == null) tokenRefreshMargin = Duration.ofMinutes(5);
        if (connectTimeout == null) connectTimeout = Duration.ofSeconds(5);
        if (responseTimeout == null) responseTimeout = Duration.ofSeconds(10);
    }
}
