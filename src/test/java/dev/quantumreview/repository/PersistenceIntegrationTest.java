package dev.quantumreview.repository;

import dev.quantumreview.domain.entity.ChecklistItem;
import dev.quantumreview.domain.entity.Issue;
import dev.quantumreview.domain.entity.PullRequest;
import dev.quantumreview.domain.entity.Repo;
import dev.quantumreview.domain.entity.TestResult;
import dev.quantumreview.domain.enums.ChecklistStatus;
import dev.quantumreview.domain.enums.TestStatus;
import dev.quantumreview.domain.valueobject.ChecklistEntry;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Runs the Flyway schema and the JPA mappings against a real PostgreSQL, so jsonb columns and
 * unique constraints behave as in production. Skipped when Docker is not available.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers(disabledWithoutDocker = true)
class PersistenceIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>(
            DockerImageName.parse("postgres:16-alpine"))
            .withDatabaseName("quantumreview_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private RepoRepository repoRepository;

    @Autowired
    private IssueRepository issueRepository;

    @Autowired
    private PullRequestRepository pullRequestRepository;

    @Autowired
    private EntityManager entityManager;

    @Test
    @DisplayName("repos are found by name and by installation")
    void repoLookups() {
        Repo shop = Repo.create("acme/shop", 555L);
        shop.markInstalled(31L, 555L);
        Repo api = Repo.create("acme/api", 556L);
        api.markInstalled(31L, null);
        repoRepository.save(shop);
        repoRepository.save(api);
        repoRepository.save(Repo.create("other/lib", 9L));
        flushAndClear();

        assertThat(repoRepository.findByFullName("acme/shop")).get()
                .extracting(Repo::getGithubId, Repo::getInstallationId)
                .containsExactly(555L, 31L);
        assertThat(repoRepository.findByInstallationId(31L)).extracting(Repo::getFullName)
                .containsExactlyInAnyOrder("acme/shop", "acme/api");
        assertThat(repoRepository.findByFullNameIn(Set.of("acme/api", "other/lib", "missing/repo")))
                .hasSize(2);
    }

    @Test
    @DisplayName("checklist items keep their jsonb tags and stay in key order")
    void checklistRoundTrip() {
        Repo repo = repoRepository.save(Repo.create("acme/shop", 555L));
        Issue issue = Issue.create(repo, 12, "Cart totals", "body");
        issue.syncChecklist(List.of(
                new ChecklistEntry("C2", "Discounts apply", false, List.of("pricing", "UI")),
                new ChecklistEntry("C1", "Totals include tax", true, List.of())));
        issueRepository.save(issue);
        flushAndClear();

        Issue loaded = issueRepository.findByRepoAndNumber(repoRepository.findByFullName("acme/shop").orElseThrow(), 12)
                .orElseThrow();
        assertThat(loaded.getChecklistItems()).extracting(ChecklistItem::getItemKey).containsExactly("C1", "C2");
        assertThat(loaded.getChecklistItems().get(1).getTags()).containsExactly("pricing", "UI");
        assertThat(loaded.getChecklistItems()).extracting(ChecklistItem::getStatus)
                .containsOnly(ChecklistStatus.PENDING);

        loaded.syncChecklist(List.of(new ChecklistEntry("C1", "Totals include tax", true, List.of())));
        issueRepository.save(loaded);
        flushAndClear();

        assertThat(issueRepository.findById(loaded.getId()).orElseThrow().getChecklistItems()).hasSize(1);
    }

    @Test
    @DisplayName("pull requests keep their manifest and results, and are found by head commit")
    void pullRequestRoundTrip() {
        Repo repo = repoRepository.save(Repo.create("acme/shop", 555L));
        PullRequest pr = PullRequest.create(repo, 42, "sha-1");
        pr.replaceManifest("{\"tests\":[{\"test_id\":\"T1\",\"checklist_ids\":[\"C1\"]}]}");
        pr.replaceTestResults(List.of(
                new PullRequest.ResultLine("T1", "test_login", TestStatus.PASSED, 12L, null, List.of("C1")),
                new PullRequest.ResultLine("T2", "test_logout", TestStatus.FAILED, 30L, "boom", List.of())));
        pullRequestRepository.save(pr);
        flushAndClear();

        PullRequest loaded = pullRequestRepository.findFirstByRepoAndHeadShaOrderByUpdatedAtDesc(
                repoRepository.findByFullName("acme/shop").orElseThrow(), "sha-1").orElseThrow();
        assertThat(loaded.getNumber()).isEqualTo(42);
        assertThat(loaded.getTestManifest()).contains("\"T1\"");
        assertThat(loaded.getTestResults()).extracting(TestResult::getTestId, TestResult::getStatus)
                .containsExactly(
                        tuple("T1", TestStatus.PASSED),
                        tuple("T2", TestStatus.FAILED));
        assertThat(loaded.getTestResults().get(0).getChecklistKeys()).containsExactly("C1");

        loaded.replaceTestResults(List.of(
                new PullRequest.ResultLine("T2", "test_logout", TestStatus.PASSED, 25L, null, List.of())));
        pullRequestRepository.save(loaded);
        flushAndClear();

        assertThat(pullRequestRepository.findById(loaded.getId()).orElseThrow().getTestResults())
                .singleElement()
                .satisfies(r -> {
                    assertThat(r.getTestId()).isEqualTo("T2");
                    assertThat(r.getStatus()).isEqualTo(TestStatus.PASSED);
                });
    }

    private void flushAndClear() {
        entityManager.flush();
        entityManager.clear();
    }
}
