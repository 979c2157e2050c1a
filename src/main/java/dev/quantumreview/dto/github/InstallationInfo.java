package dev.quantumreview.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** App-level view of an installation ({@code GET /app/installations/{id}}). */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstallationInfo(long id,
                               Account account,
                               @JsonProperty("repository_selection") String repositorySelection,
                               @JsonProperty("suspended_at") String suspendedAt) {

    public boolean isSuspended() {
        return suspendedAt != null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Account(String login, String type) {}
}
