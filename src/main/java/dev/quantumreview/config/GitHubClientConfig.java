package dev.quantumreview.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Shared WebClient for every GitHub call (token exchange and installation-scoped REST).
 *
 * <p>Timeouts are explicit so a stalled GitHub call bounds the duration of the job
 * that made it. Redirects are followed because artifact downloads answer with a 302
 * to blob storage.
 */
@Configuration
public class GitHubClientConfig {

    private static final int MAX_BODY_BYTES = 32 * 1024 * 1024;

    @Bean(name = "gitHubWebClient")
    public WebClient gitHubWebClient(WebClient.Builder builder, GitHubProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(properties.responseTimeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());
        return builder.baseUrl(properties.apiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }
}
