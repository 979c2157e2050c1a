package dev.quantumreview.job.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.analysis.AcceptanceCriteriaParser;
import dev.quantumreview.domain.entity.Issue;
import dev.quantumreview.domain.entity.Repo;
import dev.quantumreview.domain.event.RepoEvent;
import dev.quantumreview.domain.valueobject.ChecklistEntry;
import dev.quantumreview.dto.github.IssueDetails;
import dev.quantumreview.dto.request.IssueEventPayload;
import dev.quantumreview.infrastructure.github.GitHubApiClient;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobHandler;
import dev.quantumreview.job.JobType;
import dev.quantumreview.repository.IssueRepository;
import dev.quantumreview.repository.RepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives an issue's checklist from its acceptance criteria.
 *
 * <p>The issue text is re-read from GitHub when the repo is installed, so a delayed job never
 * applies an outdated edit. The checklist comment is only posted when the checklist changed,
 * which keeps redelivered jobs from commenting twice.
 */
@Component
public class ChecklistHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ChecklistHandler.class);

    private final RepoRepository repoRepository;
    private final IssueRepository issueRepository;
    private final GitHubApiClient gitHubApiClient;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChecklistHandler(RepoRepository repoRepository,
                            IssueRepository issueRepository,
                            GitHubApiClient gitHubApiClient,
                            ApplicationEventPublisher eventPublisher,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.repoRepository = repoRepository;
        this.issueRepository = issueRepository;
        this.gitHubApiClient = gitHubApiClient;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.GENERATE_CHECKLIST;
    }

    @Override
    public void handle(Job job) {
        IssueEventPayload payload = JobPayloads.read(objectMapper, job, IssueEventPayload.class).orElse(null);
        if (payload == null || !payload.isComplete()) {
            log.error("Issue payload without issue number or repository, job {} dropped", job.id());
            return;
        }
        String repoName = payload.repository().fullName();
        int number = payload.issue().number();

        Repo repo = repoRepository.findByFullName(repoName).orElse(null);
        if (repo == null) {
            log.warn("Repo not found: {}, checklist for #{} skipped", repoName, number);
            return;
        }

        String title = payload.issue().title();
        String body = payload.issue().body();
        if (repo.hasActiveInstallation()) {
            IssueDetails fresh = gitHubApiClient.getIssue(repoName, number, repo.getInstallationId());
            if (fresh != null) {
                title = fresh.title();
                body = fresh.body();
            }
        }

        Issue issue = issueRepository.findByRepoAndNumber(repo, number).orElse(null);
        if (issue == null) {
            issue = Issue.create(repo, number, title, body);
        } else {
            issue.updateContent(title, body);
        }

        List<ChecklistEntry> entries = AcceptanceCriteriaParser.parse(body);
        boolean changed = issue.syncChecklist(entries);
        issue.markProcessed();
        issueRepository.save(issue);
        log.info("Checklist for {}#{}: {} items ({})", repoName, number, entries.size(), changed ? "changed" : "unchanged");

        if (changed && !entries.isEmpty() && repo.hasActiveInstallation()) {
            postChecklistComment(repo, number, entries);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("issue_number", number);
        data.put("issue_title", title);
        data.put("checklist_count", entries.size());
        eventPublisher.publishEvent(new RepoEvent(RepoEvent.CHECKLIST_READY, repo.getGithubId(), data, clock.instant()));
    }

    private void postChecklistComment(Repo repo, int number, List<ChecklistEntry> entries) {
        try {
            gitHubApiClient.createIssueComment(repo.getFullName(), number, repo.getInstallationId(), renderComment(entries));
        } catch (RuntimeException e) {
            log.warn("Could not post checklist comment on {}#{}: {}", repo.getFullName(), number, e.getMessage());
        }
    }

    static String renderComment(List<ChecklistEntry> entries) {
        StringBuilder sb = new StringBuilder("## Generated Checklist\n\n");
        for (ChecklistEntry entry : entries) {
            sb.append(entry.required() ? "- [ ] " : "- [ ] _(optional)_ ")
                    .append("**").append(entry.key()).append("**: ").append(entry.text());
            if (!entry.tags().isEmpty()) {
                sb.append(" `").append(String.join("` `", entry.tags())).append('`');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
