package dev.quantumreview.job.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.analysis.IssueReferences;
import dev.quantumreview.analysis.TestManifestBuilder;
import dev.quantumreview.domain.entity.ChecklistItem;
import dev.quantumreview.domain.entity.Issue;
import dev.quantumreview.domain.entity.PullRequest;
import dev.quantumreview.domain.entity.Repo;
import dev.quantumreview.domain.valueobject.TestManifest;
import dev.quantumreview.dto.github.PullRequestDetails;
import dev.quantumreview.dto.github.PullRequestFile;
import dev.quantumreview.dto.request.PullRequestEventPayload;
import dev.quantumreview.infrastructure.github.GitHubApiClient;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobHandler;
import dev.quantumreview.job.JobType;
import dev.quantumreview.repository.IssueRepository;
import dev.quantumreview.repository.PullRequestRepository;
import dev.quantumreview.repository.RepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the test manifest of a pull request from its current file list.
 *
 * <p>Head commit, body and state are read from GitHub when the job runs; the webhook payload
 * only names the pull request. A closed or merged PR keeps its manifest.
 */
@Component
public class TestManifestHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(TestManifestHandler.class);

    private final RepoRepository repoRepository;
    private final IssueRepository issueRepository;
    private final PullRequestRepository pullRequestRepository;
    private final GitHubApiClient gitHubApiClient;
    private final ObjectMapper objectMapper;

    public TestManifestHandler(RepoRepository repoRepository,
                               IssueRepository issueRepository,
                               PullRequestRepository pullRequestRepository,
                               GitHubApiClient gitHubApiClient,
                               ObjectMapper objectMapper) {
        this.repoRepository = repoRepository;
        this.issueRepository = issueRepository;
        this.pullRequestRepository = pullRequestRepository;
        this.gitHubApiClient = gitHubApiClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public JobType type() {
        return JobType.GENERATE_TEST_MANIFEST;
    }

    @Override
    public void handle(Job job) {
        PullRequestEventPayload payload = JobPayloads.read(objectMapper, job, PullRequestEventPayload.class).orElse(null);
        if (payload == null || !payload.isComplete()) {
            log.error("Pull request payload without number or repository, job {} dropped", job.id());
            return;
        }
        String repoName = payload.repository().fullName();
        int number = payload.pullRequest().number();

        Repo repo = repoRepository.findByFullName(repoName).orElse(null);
        if (repo == null || !repo.hasActiveInstallation()) {
            log.warn("Repo not found or not installed: {}, manifest for PR #{} skipped", repoName, number);
            return;
        }

        PullRequestDetails fresh = gitHubApiClient.getPullRequest(repoName, number, repo.getInstallationId());
        if (fresh == null) {
            log.warn("PR {}#{} not returned by GitHub, manifest skipped", repoName, number);
            return;
        }

        PullRequest pr = pullRequestRepository.findByRepoAndNumber(repo, number).orElse(null);
        if (pr == null) {
            pr = PullRequest.create(repo, number, fresh.headSha());
        } else {
            pr.updateHead(fresh.headSha());
        }
        pr.syncState(fresh.isOpen(), fresh.merged());
        if (!pr.isOpen()) {
            pullRequestRepository.save(pr);
            log.info("PR {}#{} is {}, manifest left as is", repoName, number, pr.getState());
            return;
        }

        Issue linked = IssueReferences.linkedIssueNumber(fresh.body())
                .flatMap(n -> issueRepository.findByRepoAndNumber(repo, n))
                .orElse(null);
        pr.linkIssue(linked);

        List<PullRequestFile> files = gitHubApiClient.getPullRequestFiles(repoName, number, repo.getInstallationId());
        Map<String, String> checklist = new LinkedHashMap<>();
        if (linked != null) {
            for (ChecklistItem item : linked.getChecklistItems()) {
                checklist.put(item.getItemKey(), item.getText());
            }
        }
        TestManifest manifest = TestManifestBuilder.build(files, checklist);
        pr.replaceManifest(toJson(manifest));
        pullRequestRepository.save(pr);

        log.info("Generated test manifest for {}#{}: {} files, {} tests, linked issue {}",
                repoName, number, files.size(), manifest.tests().size(), linked == null ? "none" : "#" + linked.getNumber());
    }

    private String toJson(TestManifest manifest) {
        try {
            return objectMapper.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize test manifest", e);
        }
    }
}
