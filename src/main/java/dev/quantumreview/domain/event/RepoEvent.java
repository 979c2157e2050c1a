package dev.quantumreview.domain.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification about a repository, broadcast to connected clients after the producing
 * transaction commits. {@code repoId} is GitHub's repository id.
 */
public record RepoEvent(String type, Long repoId, Map<String, Object> data, Instant occurredAt) {

    public static final String ISSUE_UPDATED = "issue_updated";
    public static final String CHECKLIST_READY = "checklist_ready";
    public static final String PR_VALIDATED = "pr_validated";

    public RepoEvent {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("type required");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
