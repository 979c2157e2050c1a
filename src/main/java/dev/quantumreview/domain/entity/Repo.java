package dev.quantumreview.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A repository known to the app. Identified by its full name; the installation link is
 * maintained by installation sync jobs.
 */
@Entity
@Table(name = "repos", indexes = {
        @Index(name = "idx_repo_installation", columnList = "installation_id")
})
public class Repo {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "full_name", unique = true, nullable = false)
    private String fullName;

    @Column(name = "github_id")
    private Long githubId;

    @Column(name = "installation_id")
    private Long installationId;

    @Column(name = "installed", nullable = false)
    private boolean installed;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected Repo() {
    }

    public static Repo create(String fullName, Long githubId) {
        if (fullName == null || fullName.isBlank()) throw new IllegalArgumentException("fullName required");
        Repo r = new Repo();
        r.id = UUID.randomUUID();
        r.fullName = fullName;
        r.githubId = githubId;
        r.createdAt = Instant.now();
        r.updatedAt = r.createdAt;
        return r;
    }

    public void markInstalled(long installationId, Long githubId) {
        this.installationId = installationId;
        this.installed = true;
        if (githubId != null) this.githubId = githubId;
        touch();
    }

    public void markUninstalled() {
        this.installationId = null;
        this.installed = false;
        touch();
    }

    /** True when GitHub calls can be made for this repo. */
    public boolean hasActiveInstallation() {
        return installed && installationId != null;
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() { return id; }
    public String getFullName() { return fullName; }
    public Long getGithubId() { return githubId; }
    public Long getInstallationId() { return installationId; }
    public boolean isInstalled() { return installed; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
