package dev.quantumreview.job.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.analysis.JUnitReportParser;
import dev.quantumreview.analysis.TestReportArchive;
import dev.quantumreview.domain.entity.ChecklistItem;
import dev.quantumreview.domain.entity.PullRequest;
import dev.quantumreview.domain.entity.Repo;
import dev.quantumreview.domain.enums.ChecklistStatus;
import dev.quantumreview.domain.enums.TestStatus;
import dev.quantumreview.domain.enums.ValidationStatus;
import dev.quantumreview.domain.event.RepoEvent;
import dev.quantumreview.domain.valueobject.ParsedTestCase;
import dev.quantumreview.domain.valueobject.TestManifest;
import dev.quantumreview.dto.github.WorkflowArtifact;
import dev.quantumreview.dto.request.WorkflowRunEventPayload;
import dev.quantumreview.exception.ReportParseException;
import dev.quantumreview.infrastructure.github.GitHubApiClient;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobHandler;
import dev.quantumreview.job.JobType;
import dev.quantumreview.repository.PullRequestRepository;
import dev.quantumreview.repository.RepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the test report of a completed workflow run onto the pull request and its checklist.
 *
 * <p>Only runs that publish an {@value #REPORT_ARTIFACT} artifact are considered. Results are
 * replaced wholesale by the latest report. A checklist item takes FAILED if any linked test
 * failed, otherwise PASSED if any linked test passed. The pull request is VALIDATED only when
 * the report holds at least one test and every test passed.
 */
@Component
public class WorkflowRunHandler implements JobHandler {

    static final String REPORT_ARTIFACT = "autoqa-test-report";

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunHandler.class);

    private final RepoRepository repoRepository;
    private final PullRequestRepository pullRequestRepository;
    private final GitHubApiClient gitHubApiClient;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WorkflowRunHandler(RepoRepository repoRepository,
                              PullRequestRepository pullRequestRepository,
                              GitHubApiClient gitHubApiClient,
                              ApplicationEventPublisher eventPublisher,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.repoRepository = repoRepository;
        this.pullRequestRepository = pullRequestRepository;
        this.gitHubApiClient = gitHubApiClient;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public JobType type() {
        return JobType.PROCESS_WORKFLOW_RUN;
    }

    @Override
    public void handle(Job job) {
        WorkflowRunEventPayload payload = JobPayloads.read(objectMapper, job, WorkflowRunEventPayload.class).orElse(null);
        if (payload == null || !payload.isComplete()) {
            log.error("Workflow run payload without run id or repository, job {} dropped", job.id());
            return;
        }
        String repoName = payload.repository().fullName();
        long runId = payload.workflowRun().id();
        String headSha = payload.workflowRun().headSha();

        Repo repo = repoRepository.findByFullName(repoName).orElse(null);
        if (repo == null || !repo.hasActiveInstallation()) {
            log.warn("Repo not found or not installed: {}, run {} skipped", repoName, runId);
            return;
        }
        PullRequest pr = headSha == null ? null
                : pullRequestRepository.findFirstByRepoAndHeadShaOrderByUpdatedAtDesc(repo, headSha).orElse(null);
        if (pr == null) {
            log.warn("No PR for SHA {} in {}, run {} skipped", headSha, repoName, runId);
            return;
        }

        Optional<WorkflowArtifact> artifact = gitHubApiClient.listWorkflowRunArtifacts(repoName, runId, repo.getInstallationId())
                .stream()
                .filter(a -> REPORT_ARTIFACT.equals(a.name()) && !a.expired())
                .findFirst();
        if (artifact.isEmpty()) {
            log.info("Run {} in {} has no {} artifact, nothing to map", runId, repoName, REPORT_ARTIFACT);
            return;
        }

        byte[] archive = gitHubApiClient.downloadArtifact(repoName, artifact.get().id(), repo.getInstallationId());
        List<ParsedTestCase> cases = readReport(archive, runId);
        apply(pr, cases);

        long passed = cases.stream().filter(c -> c.status() == TestStatus.PASSED).count();
        long failed = cases.stream().filter(c -> c.status() == TestStatus.FAILED).count();
        log.info("Run {} mapped onto {}#{}: {} tests, {} passed, {} failed -> {}",
                runId, repoName, pr.getNumber(), cases.size(), passed, failed, pr.getValidationStatus());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("pr_number", pr.getNumber());
        data.put("run_id", runId);
        data.put("validation_status", pr.getValidationStatus().name().toLowerCase());
        data.put("total", cases.size());
        data.put("passed", passed);
        data.put("failed", failed);
        eventPublisher.publishEvent(new RepoEvent(RepoEvent.PR_VALIDATED, repo.getGithubId(), data, clock.instant()));
    }

    private List<ParsedTestCase> readReport(byte[] archive, long runId) {
        try {
            List<ParsedTestCase> all = new ArrayList<>();
            for (String xml : TestReportArchive.xmlReports(archive)) {
                all.addAll(JUnitReportParser.parse(xml));
            }
            return mergeByTestId(all);
        } catch (ReportParseException e) {
            log.error("Test report of run {} is unreadable, recording no results: {}", runId, e.getMessage());
            return List.of();
        }
    }

    /** One result per test id; the most severe outcome wins. */
    static List<ParsedTestCase> mergeByTestId(List<ParsedTestCase> cases) {
        Map<String, ParsedTestCase> merged = new LinkedHashMap<>();
        for (ParsedTestCase c : cases) {
            merged.merge(c.testId(), c, (a, b) -> b.status().severity() > a.status().severity() ? b : a);
        }
        return List.copyOf(merged.values());
    }

    private void apply(PullRequest pr, List<ParsedTestCase> cases) {
        Map<String, TestManifest.Entry> manifest = readManifest(pr).byTestId();

        List<PullRequest.ResultLine> lines = new ArrayList<>();
        Map<String, ChecklistStatus> verdicts = new HashMap<>();
        for (ParsedTestCase c : cases) {
            TestManifest.Entry entry = manifest.get(c.testId());
            List<String> keys = entry == null ? List.of() : entry.checklistIds();
            lines.add(new PullRequest.ResultLine(c.testId(), c.name(), c.status(), c.durationMs(), c.errorMessage(), keys));
            for (String key : keys) {
                if (c.status() == TestStatus.FAILED) {
                    verdicts.put(key, ChecklistStatus.FAILED);
                } else if (c.status() == TestStatus.PASSED) {
                    verdicts.putIfAbsent(key, ChecklistStatus.PASSED);
                }
            }
        }
        pr.replaceTestResults(lines);

        if (pr.getLinkedIssue() != null) {
            for (ChecklistItem item : pr.getLinkedIssue().getChecklistItems()) {
                ChecklistStatus verdict = verdicts.get(item.getItemKey());
                if (verdict != null) item.applyStatus(verdict);
            }
        }

        boolean allPassed = !cases.isEmpty() && cases.stream().allMatch(c -> c.status() == TestStatus.PASSED);
        pr.applyValidation(allPassed ? ValidationStatus.VALIDATED : ValidationStatus.NEEDS_WORK);
    }

    private TestManifest readManifest(PullRequest pr) {
        if (pr.getTestManifest() == null) return TestManifest.empty();
        try {
            return objectMapper.readValue(pr.getTestManifest(), TestManifest.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored manifest of PR {} is unreadable, results mapped without checklist links", pr.getId());
            return TestManifest.empty();
        }
    }
}
