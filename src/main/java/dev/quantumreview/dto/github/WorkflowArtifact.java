package dev.quantumreview.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowArtifact(long id,
                               String name,
                               boolean expired,
                               @JsonProperty("size_in_bytes") long sizeInBytes) {}
