package dev.quantumreview.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** One page of {@code GET /installation/repositories}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstallationRepositoriesPage(@JsonProperty("total_count") int totalCount,
                                           List<GitHubRepository> repositories) {
    public InstallationRepositoriesPage {
        repositories = repositories == null ? List.of() : repositories;
    }
}
