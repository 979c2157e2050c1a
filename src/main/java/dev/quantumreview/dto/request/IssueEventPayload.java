package dev.quantumreview.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IssueEventPayload(String action, Issue issue, RepositoryRef repository) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Issue(Integer number, String title, String body) {}

    public boolean isComplete() {
        return issue != null && issue.number() != null
                && repository != null && repository.fullName() != null && !repository.fullName().isBlank();
    }
}
