package dev.quantumreview.domain.entity;

import dev.quantumreview.domain.enums.TestStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one test from the latest CI report of a pull request.
 */
@Entity
@Table(name = "test_results", uniqueConstraints = {
        @UniqueConstraint(name = "uq_test_result_pr_test", columnNames = {"pull_request_id", "test_id"})
})
public class TestResult {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pull_request_id", nullable = false)
    private PullRequest pullRequest;

    @Column(name = "test_id", nullable = false, length = 512)
    private String testId;

    @Column(length = 1024)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TestStatus status;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "checklist_keys", columnDefinition = "jsonb", nullable = false)
    private List<String> checklistKeys = new ArrayList<>();

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected TestResult() {
    }

    static TestResult create(PullRequest pullRequest, String testId) {
        TestResult r = new TestResult();
        r.id = UUID.randomUUID();
        r.pullRequest = pullRequest;
        r.testId = testId;
        return r;
    }

    void record(String name, TestStatus status, Long durationMs, String errorMessage, List<String> checklistKeys) {
        this.name = name;
        this.status = status;
        this.durationMs = durationMs;
        this.errorMessage = truncate(errorMessage);
        this.checklistKeys = new ArrayList<>(checklistKeys);
        this.recordedAt = Instant.now();
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 2000) return message;
        return message.substring(0, 2000);
    }

    public UUID getId() { return id; }
    public PullRequest getPullRequest() { return pullRequest; }
    public String getTestId() { return testId; }
    public String getName() { return name; }
    public TestStatus getStatus() { return status; }
    public Long getDurationMs() { return durationMs; }
    public String getErrorMessage() { return errorMessage; }
    public List<String> getChecklistKeys() { return List.copyOf(checklistKeys); }
}
