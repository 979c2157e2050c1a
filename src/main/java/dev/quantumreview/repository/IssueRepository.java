package dev.quantumreview.repository;

import dev.quantumreview.domain.entity.Issue;
import dev.quantumreview.domain.entity.Repo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface IssueRepository extends JpaRepository<Issue, UUID> {
    Optional<Issue> findByRepoAndNumber(Repo repo, Integer number);
}
