package dev.quantumreview.job.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.domain.entity.Repo;
import dev.quantumreview.dto.github.GitHubRepository;
import dev.quantumreview.dto.github.InstallationInfo;
import dev.quantumreview.dto.request.InstallationEventPayload;
import dev.quantumreview.dto.request.RepositoryRef;
import dev.quantumreview.infrastructure.github.GitHubApiClient;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobHandler;
import dev.quantumreview.job.JobType;
import dev.quantumreview.repository.RepoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Keeps the repo table in line with what each installation can access.
 *
 * <p>{@code created} and {@code added} re-list the installation's repositories from GitHub and
 * converge on that list; repos no longer listed lose the installation. {@code deleted} and
 * {@code removed} only touch local rows.
 */
@Component
public class InstallationSyncHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(InstallationSyncHandler.class);

    private final GitHubApiClient gitHubApiClient;
    private final RepoRepository repoRepository;
    private final ObjectMapper objectMapper;

    public InstallationSyncHandler(GitHubApiClient gitHubApiClient, RepoRepository repoRepository,
                                   ObjectMapper objectMapper) {
        this.gitHubApiClient = gitHubApiClient;
        this.repoRepository = repoRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public JobType type() {
        return JobType.SYNC_INSTALLATION_REPOS;
    }

    @Override
    public void handle(Job job) {
        InstallationEventPayload payload = JobPayloads.read(objectMapper, job, InstallationEventPayload.class).orElse(null);
        if (payload == null || payload.installationId() == null) {
            log.error("Installation payload without installation id, job {} dropped", job.id());
            return;
        }
        long installationId = payload.installationId();
        String action = Objects.requireNonNullElse(payload.action(), "");
        switch (action) {
            case "created", "added" -> syncFromGitHub(installationId);
            case "deleted" -> uninstallAll(installationId);
            case "removed" -> uninstallRemoved(installationId, payload.repositoriesRemoved());
            default -> log.debug("Installation action '{}' needs no sync", action);
        }
    }

    private void syncFromGitHub(long installationId) {
        InstallationInfo installation = gitHubApiClient.getInstallation(installationId);
        if (installation != null && installation.isSuspended()) {
            log.info("Installation {} is suspended, treating its repos as uninstalled", installationId);
            uninstallAll(installationId);
            return;
        }

        List<GitHubRepository> accessible = gitHubApiClient.listInstallationRepositories(installationId);
        Set<String> names = accessible.stream().map(GitHubRepository::fullName).collect(Collectors.toSet());

        for (GitHubRepository remote : accessible) {
            Repo repo = repoRepository.findByFullName(remote.fullName())
                    .orElseGet(() -> Repo.create(remote.fullName(), remote.id()));
            repo.markInstalled(installationId, remote.id());
            repoRepository.save(repo);
        }

        int revoked = 0;
        for (Repo repo : repoRepository.findByInstallationId(installationId)) {
            if (!names.contains(repo.getFullName())) {
                repo.markUninstalled();
                revoked++;
            }
        }
        log.info("Installation {} synced: {} repos accessible, {} revoked", installationId, accessible.size(), revoked);
    }

    private void uninstallAll(long installationId) {
        List<Repo> repos = repoRepository.findByInstallationId(installationId);
        repos.forEach(Repo::markUninstalled);
        log.info("Marked {} repos uninstalled for installation {}", repos.size(), installationId);
    }

    private void uninstallRemoved(long installationId, List<RepositoryRef> removed) {
        Set<String> names = removed.stream()
                .map(RepositoryRef::fullName)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (names.isEmpty()) return;
        int count = 0;
        for (Repo repo : repoRepository.findByFullNameIn(names)) {
            // a repo may already have moved to another installation
            if (Objects.equals(repo.getInstallationId(), installationId)) {
                repo.markUninstalled();
                count++;
            }
        }
        log.info("Marked {} of {} removed repos uninstalled for installation {}", count, names.size(), installationId);
    }
}
