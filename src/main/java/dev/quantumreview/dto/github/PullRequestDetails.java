package dev.quantumreview.dto.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestDetails(int number, String body, String state, boolean merged, Head head) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(String sha, String ref) {}

    public boolean isOpen() {
        return "open".equals(state);
    }

    public String headSha() {
        return head == null ? null : head.sha();
    }
}
