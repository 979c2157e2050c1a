package dev.quantumreview.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Shared shape of {@code installation} and {@code installation_repositories} webhooks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstallationEventPayload(
        String action,
        Installation installation,
        @JsonProperty("repositories_removed") List<RepositoryRef> repositoriesRemoved
) {
    public InstallationEventPayload {
        repositoriesRemoved = repositoriesRemoved == null ? List.of() : repositoriesRemoved;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Installation(Long id, Account account) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Account(String login) {}

    public Long installationId() {
        return installation == null ? null : installation.id();
    }
}
