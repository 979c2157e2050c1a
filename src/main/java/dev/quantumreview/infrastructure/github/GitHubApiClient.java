package dev.quantumreview.infrastructure.github;

import dev.quantumreview.dto.github.GitHubRepository;
import dev.quantumreview.dto.github.InstallationInfo;
import dev.quantumreview.dto.github.InstallationRepositoriesPage;
import dev.quantumreview.dto.github.IssueDetails;
import dev.quantumreview.dto.github.PullRequestDetails;
import dev.quantumreview.dto.github.PullRequestFile;
import dev.quantumreview.dto.github.WorkflowArtifact;
import dev.quantumreview.dto.github.WorkflowArtifactsPage;
import dev.quantumreview.exception.GitHubApiException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * GitHub REST API client with circuit breaker and rate limiting.
 *
 * <p>Installation-scoped calls authenticate with {@code token <installation token>} obtained
 * from {@link GitHubTokenProvider} at call time; app-level calls use {@code Bearer <jwt>}.
 * Calls block on the job worker thread. Error statuses surface as {@link GitHubApiException}
 * so the job fails and the queue redelivers it.
 */
@Component
public class GitHubApiClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);

    private static final int PER_PAGE = 100;
    private static final int MAX_PAGES = 10;

    private final WebClient webClient;
    private final GitHubTokenProvider tokenProvider;

    public GitHubApiClient(@Qualifier("gitHubWebClient") WebClient webClient, GitHubTokenProvider tokenProvider) {
        this.webClient = webClient;
        this.tokenProvider = tokenProvider;
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public List<GitHubRepository> listInstallationRepositories(long installationId) {
        String auth = installationAuth(installationId);
        List<GitHubRepository> all = new ArrayList<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            String uri = "/installation/repositories?per_page=" + PER_PAGE + "&page=" + page;
            InstallationRepositoriesPage body = call("GET " + uri, () -> webClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, auth)
                    .retrieve()
                    .bodyToMono(InstallationRepositoriesPage.class)
                    .block());
            if (body == null || body.repositories().isEmpty()) break;
            all.addAll(body.repositories());
            if (body.repositories().size() < PER_PAGE || all.size() >= body.totalCount()) break;
        }
        if (all.size() >= PER_PAGE * MAX_PAGES) {
            log.warn("Installation {} has {}+ repositories, listing truncated", installationId, all.size());
        }
        return all;
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public PullRequestDetails getPullRequest(String repo, int pr, long installationId) {
        String auth = installationAuth(installationId);
        String uri = "/repos/" + repo + "/pulls/" + pr;
        return call("GET " + uri, () -> webClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .retrieve()
                .bodyToMono(PullRequestDetails.class)
                .block());
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public List<PullRequestFile> getPullRequestFiles(String repo, int pr, long installationId) {
        String auth = installationAuth(installationId);
        List<PullRequestFile> all = new ArrayList<>();
        for (int page = 1; page <= MAX_PAGES; page++) {
            String uri = "/repos/" + repo + "/pulls/" + pr + "/files?per_page=" + PER_PAGE + "&page=" + page;
            List<PullRequestFile> files = call("GET " + uri, () -> webClient.get()
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, auth)
                    .retrieve()
                    .bodyToMono(new ParameterizedTypeReference<List<PullRequestFile>>() {})
                    .block());
            if (files == null || files.isEmpty()) break;
            all.addAll(files);
            if (files.size() < PER_PAGE) break;
        }
        if (all.size() >= PER_PAGE * MAX_PAGES) {
            log.warn("PR {}#{} has {}+ files, manifest may be incomplete", repo, pr, all.size());
        }
        return all;
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public IssueDetails getIssue(String repo, int issueNumber, long installationId) {
        String auth = installationAuth(installationId);
        String uri = "/repos/" + repo + "/issues/" + issueNumber;
        return call("GET " + uri, () -> webClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .retrieve()
                .bodyToMono(IssueDetails.class)
                .block());
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public void createIssueComment(String repo, int issueNumber, long installationId, String body) {
        String auth = installationAuth(installationId);
        String uri = "/repos/" + repo + "/issues/" + issueNumber + "/comments";
        call("POST " + uri, () -> webClient.post()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .bodyValue(Map.of("body", body))
                .retrieve()
                .toBodilessEntity()
                .block());
        log.info("Comment posted on {}#{}", repo, issueNumber);
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public List<WorkflowArtifact> listWorkflowRunArtifacts(String repo, long runId, long installationId) {
        String auth = installationAuth(installationId);
        String uri = "/repos/" + repo + "/actions/runs/" + runId + "/artifacts?per_page=" + PER_PAGE;
        WorkflowArtifactsPage body = call("GET " + uri, () -> webClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .retrieve()
                .bodyToMono(WorkflowArtifactsPage.class)
                .block());
        return body == null ? List.of() : body.artifacts();
    }

    /**
     * Downloads an artifact archive. GitHub answers with a redirect to blob storage, which the
     * shared client follows.
     */
    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public byte[] downloadArtifact(String repo, long artifactId, long installationId) {
        String auth = installationAuth(installationId);
        String uri = "/repos/" + repo + "/actions/artifacts/" + artifactId + "/zip";
        byte[] archive = call("GET " + uri, () -> webClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, auth)
                .retrieve()
                .bodyToMono(byte[].class)
                .block());
        if (archive == null) {
            throw new GitHubApiException("Empty artifact archive " + artifactId + " in " + repo, 200, null);
        }
        log.debug("Downloaded artifact {} from {} ({} bytes)", artifactId, repo, archive.length);
        return archive;
    }

    @CircuitBreaker(name = "github-api") @RateLimiter(name = "github-api")
    public InstallationInfo getInstallation(long installationId) {
        String jwt = tokenProvider.getAppJwt();
        String uri = "/app/installations/" + installationId;
        return call("GET " + uri, () -> webClient.get()
                .uri(uri)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + jwt)
                .retrieve()
                .bodyToMono(InstallationInfo.class)
                .block());
    }

    private String installationAuth(long installationId) {
        return "token " + tokenProvider.getInstallationToken(installationId);
    }

    private static <T> T call(String description, Supplier<T> request) {
        try {
            return request.get();
        } catch (WebClientResponseException e) {
            throw new GitHubApiException("GitHub " + description + " failed with status " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        }
    }
}
