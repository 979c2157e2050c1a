package dev.quantumreview.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.quantumreview.domain.event.RepoEvent;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobIntent;
import dev.quantumreview.job.JobType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps a webhook (event type, action) pair onto jobs. Pure: no I/O, no exceptions, unknown
 * or missing event types and actions are ignored.
 *
 * <pre>
 * installation               created, deleted     SYNC_INSTALLATION_REPOS
 * installation_repositories  added, removed       SYNC_INSTALLATION_REPOS
 * issues                     opened, edited       GENERATE_CHECKLIST + issue_updated
 * pull_request               opened, synchronize  GENERATE_TEST_MANIFEST
 * pull_request               closed               HANDLE_PR_CLOSED
 * workflow_run               completed            PROCESS_WORKFLOW_RUN
 * </pre>
 */
@Component
public class GitHubEventRouter {

    private static final Logger log = LoggerFactory.getLogger(GitHubEventRouter.class);

    private static final Set<String> INSTALLATION_ACTIONS = Set.of("created", "deleted");
    private static final Set<String> INSTALLATION_REPOSITORIES_ACTIONS = Set.of("added", "removed");
    private static final Set<String> ISSUE_ACTIONS = Set.of("opened", "edited");
    private static final Set<String> PR_MANIFEST_ACTIONS = Set.of("opened", "synchronize");

    private final Clock clock;

    public GitHubEventRouter(Clock clock) {
        this.clock = clock;
    }

    public RoutingDecision route(String eventType, String action, JsonNode payload) {
        if (eventType == null || eventType.isEmpty()) {
            log.debug("Delivery without event type ignored");
            return RoutingDecision.ignored();
        }
        String act = action == null ? "" : action;
        switch (eventType) {
            case "installation":
                return INSTALLATION_ACTIONS.contains(act)
                        ? RoutingDecision.of(new JobIntent(JobType.SYNC_INSTALLATION_REPOS, installationKey(payload)))
                        : unhandled(eventType, act);
            case "installation_repositories":
                return INSTALLATION_REPOSITORIES_ACTIONS.contains(act)
                        ? RoutingDecision.of(new JobIntent(JobType.SYNC_INSTALLATION_REPOS, installationKey(payload)))
                        : unhandled(eventType, act);
            case "issues":
                return ISSUE_ACTIONS.contains(act)
                        ? new RoutingDecision(
                                List.of(new JobIntent(JobType.GENERATE_CHECKLIST, repoKey(payload))),
                                List.of(issueUpdated(act, payload)))
                        : unhandled(eventType, act);
            case "pull_request":
                if (PR_MANIFEST_ACTIONS.contains(act)) {
                    return RoutingDecision.of(new JobIntent(JobType.GENERATE_TEST_MANIFEST, repoKey(payload)));
                }
                if ("closed".equals(act)) {
                    return RoutingDecision.of(new JobIntent(JobType.HANDLE_PR_CLOSED, repoKey(payload)));
                }
                return unhandled(eventType, act);
            case "workflow_run":
                return "completed".equals(act)
                        ? RoutingDecision.of(new JobIntent(JobType.PROCESS_WORKFLOW_RUN, repoKey(payload)))
                        : unhandled(eventType, act);
            case "check_suite":
            case "check_run":
                log.info("Received {} ({}), no processing configured", eventType, act);
                return RoutingDecision.ignored();
            default:
                return unhandled(eventType, act);
        }
    }

    private RoutingDecision unhandled(String eventType, String action) {
        log.debug("No route for event={} action={}", eventType, action);
        return RoutingDecision.ignored();
    }

    private RepoEvent issueUpdated(String action, JsonNode payload) {
        JsonNode repository = field(payload, "repository");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", action);
        data.put("issue_number", numberOrNull(field(field(payload, "issue"), "number")));
        data.put("repo_full_name", textOrNull(field(repository, "full_name")));
        Long repoId = numberOrNull(field(repository, "id"));
        return new RepoEvent(RepoEvent.ISSUE_UPDATED, repoId, data, clock.instant());
    }

    static String installationKey(JsonNode payload) {
        Long id = numberOrNull(field(field(payload, "installation"), "id"));
        return id == null ? Job.UNPARTITIONED : "installation:" + id;
    }

    static String repoKey(JsonNode payload) {
        String fullName = textOrNull(field(field(payload, "repository"), "full_name"));
        return fullName == null || fullName.isEmpty() ? Job.UNPARTITIONED : "repo:" + fullName;
    }

    private static JsonNode field(JsonNode node, String name) {
        return node == null ? null : node.get(name);
    }

    private static Long numberOrNull(JsonNode node) {
        return node != null && node.canConvertToLong() ? node.asLong() : null;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
