package dev.quantumreview.repository;

import dev.quantumreview.domain.entity.PullRequest;
import dev.quantumreview.domain.entity.Repo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PullRequestRepository extends JpaRepository<PullRequest, UUID> {
    Optional<PullRequest> findByRepoAndNumber(Repo repo, Integer number);

    /** Several PRs can share a head commit; the most recently touched one wins. */
    Optional<PullRequest> findFirstByRepoAndHeadShaOrderByUpdatedAtDesc(Repo repo, String headSha);
}
