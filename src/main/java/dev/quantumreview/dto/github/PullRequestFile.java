package dev.quantumreview.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Entry of {@code GET /repos/{repo}/pulls/{n}/files}. {@code patch} is absent for binary
 * and very large files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestFile(String filename, String status, String patch, int additions, int deletions) {}
