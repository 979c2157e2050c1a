package dev.quantumreview.domain.entity;

import dev.quantumreview.domain.enums.PullRequestState;
import dev.quantumreview.domain.enums.TestStatus;
import dev.quantumreview.domain.enums.ValidationStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A pull request with its test manifest and latest CI verdict.
 *
 * <p>The manifest is kept as raw JSON; {@code TestManifest} is its typed view.
 */
@Entity
@Table(name = "pull_requests", uniqueConstraints = {
        @UniqueConstraint(name = "uq_pr_repo_number", columnNames = {"repo_id", "number"})
}, indexes = {
        @Index(name = "idx_pr_head_sha", columnList = "repo_id, head_sha")
})
public class PullRequest {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "repo_id", nullable = false)
    private Repo repo;

    @Column(nullable = false)
    private Integer number;

    @Column(name = "head_sha", length = 40)
    private String headSha;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "linked_issue_id")
    private Issue linkedIssue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PullRequestState state;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "test_manifest", columnDefinition = "jsonb")
    private String testManifest;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, length = 20)
    private ValidationStatus validationStatus;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "pullRequest", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("testId ASC")
    private List<TestResult> testResults = new ArrayList<>();

    protected PullRequest() {
    }

    public static PullRequest create(Repo repo, int number, String headSha) {
        PullRequest pr = new PullRequest();
        pr.id = UUID.randomUUID();
        pr.repo = repo;
        pr.number = number;
        pr.headSha = headSha;
        pr.state = PullRequestState.OPEN;
        pr.validationStatus = ValidationStatus.PENDING;
        pr.createdAt = Instant.now();
        pr.updatedAt = pr.createdAt;
        return pr;
    }

    /** A new head commit invalidates the previous CI verdict. State is left alone. */
    public void updateHead(String headSha) {
        if (headSha != null && !headSha.equals(this.headSha)) {
            this.headSha = headSha;
            this.validationStatus = ValidationStatus.PENDING;
        }
        touch();
    }

    /**
     * Applies the state GitHub reports. MERGED is terminal; a closed PR only reopens when GitHub
     * says it is open again.
     */
    public void syncState(boolean open, boolean merged) {
        if (state == PullRequestState.MERGED) return;
        if (merged) {
            state = PullRequestState.MERGED;
        } else {
            state = open ? PullRequestState.OPEN : PullRequestState.CLOSED;
        }
        touch();
    }

    public void linkIssue(Issue issue) {
        this.linkedIssue = issue;
        touch();
    }

    public void replaceManifest(String manifestJson) {
        this.testManifest = manifestJson;
        touch();
    }

    public void close(boolean merged) {
        if (state == PullRequestState.MERGED) return;
        this.state = merged ? PullRequestState.MERGED : PullRequestState.CLOSED;
        touch();
    }

    public boolean isOpen() {
        return state == PullRequestState.OPEN;
    }

    /**
     * Upserts one result per test id and removes results of tests missing from the report.
     */
    public void replaceTestResults(List<ResultLine> lines) {
        Map<String, TestResult> existing = new HashMap<>();
        for (TestResult r : testResults) existing.put(r.getTestId(), r);

        List<TestResult> next = new ArrayList<>();
        for (ResultLine line : lines) {
            TestResult result = existing.remove(line.testId());
            if (result == null) result = TestResult.create(this, line.testId());
            result.record(line.name(), line.status(), line.durationMs(), line.errorMessage(), line.checklistKeys());
            next.add(result);
        }
        testResults.removeIf(r -> existing.containsKey(r.getTestId()));
        for (TestResult r : next) {
            if (!testResults.contains(r)) testResults.add(r);
        }
        touch();
    }

    public void applyValidation(ValidationStatus status) {
        this.validationStatus = status;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() { return id; }
    public Repo getRepo() { return repo; }
    public Integer getNumber() { return number; }
    public String getHeadSha() { return headSha; }
    public Issue getLinkedIssue() { return linkedIssue; }
    public PullRequestState getState() { return state; }
    public String getTestManifest() { return testManifest; }
    public ValidationStatus getValidationStatus() { return validationStatus; }
    public List<TestResult> getTestResults() { return List.copyOf(testResults); }

    /** Input for {@link #replaceTestResults}; test ids must be unique. */
    public record ResultLine(String testId, String name, TestStatus status, Long durationMs,
                             String errorMessage, List<String> checklistKeys) {}
}
