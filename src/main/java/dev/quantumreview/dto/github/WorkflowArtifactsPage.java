package dev.quantumreview.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowArtifactsPage(@JsonProperty("total_count") int totalCount, List<WorkflowArtifact> artifacts) {
    public WorkflowArtifactsPage {
        artifacts = artifacts == null ? List.of() : artifacts;
    }
}
