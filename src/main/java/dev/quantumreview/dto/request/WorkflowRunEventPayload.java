package dev.quantumreview.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowRunEventPayload(
        String action,
        @JsonProperty("workflow_run") WorkflowRun workflowRun,
        RepositoryRef repository
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkflowRun(Long id,
                              String name,
                              @JsonProperty("head_sha") String headSha,
                              String conclusion) {}

    public boolean isComplete() {
        return workflowRun != null && workflowRun.id() != null
                && repository != null && repository.fullName() != null && !repository.fullName().isBlank();
    }
}
