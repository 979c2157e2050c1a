package dev.quantumreview.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestEventPayload(
        String action,
        @JsonProperty("pull_request") PullRequest pullRequest,
        RepositoryRef repository
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequest(Integer number, String body, boolean merged, Head head) {}
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(String sha, String ref) {}

    public boolean isComplete() {
        return pullRequest != null && pullRequest.number() != null
                && repository != null && repository.fullName() != null && !repository.fullName().isBlank();
    }

    public String headSha() {
        return pullRequest == null || pullRequest.head() == null ? null : pullRequest.head().sha();
    }
}
