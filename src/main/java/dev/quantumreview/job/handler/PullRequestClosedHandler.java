package dev.quantumreview.job.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.domain.entity.PullRequest;
import dev.quantumreview.dto.request.PullRequestEventPayload;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobHandler;
import dev.quantumreview.job.JobType;
import dev.quantumreview.repository.PullRequestRepository;
import dev.quantumreview.repository.RepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PullRequestClosedHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(PullRequestClosedHandler.class);

    private final RepoRepository repoRepository;
    private final PullRequestRepository pullRequestRepository;
    private final ObjectMapper objectMapper;

    public PullRequestClosedHandler(RepoRepository repoRepository,
                                    PullRequestRepository pullRequestRepository,
                                    ObjectMapper objectMapper) {
        this.repoRepository = repoRepository;
        this.pullRequestRepository = pullRequestRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public JobType type() {
        return JobType.HANDLE_PR_CLOSED;
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
        boolean merged = payload.pullRequest().merged();

        PullRequest pr = repoRepository.findByFullName(repoName)
                .flatMap(repo -> pullRequestRepository.findByRepoAndNumber(repo, number))
                .orElse(null);
        if (pr == null) {
            log.info("PR {}#{} closed but never tracked", repoName, number);
            return;
        }
        pr.close(merged);
        log.info("PR {}#{} {}", repoName, number, merged ? "merged" : "closed");
    }
}
