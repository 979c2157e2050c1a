package dev.quantumreview.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record IssueDetails(int number, String title, String body, String state) {}
