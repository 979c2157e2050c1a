package dev.quantumreview.repository;

import dev.quantumreview.domain.entity.Repo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RepoRepository extends JpaRepository<Repo, UUID> {
    Optional<Repo> findByFullName(String fullName);
    List<Repo> findByInstallationId(Long installationId);
    List<Repo> findByFullNameIn(Collection<String> fullNames);
}
