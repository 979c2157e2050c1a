package dev.quantumreview.domain.entity;

import dev.quantumreview.domain.enums.IssueStatus;
import dev.quantumreview.domain.valueobject.ChecklistEntry;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A GitHub issue and the checklist derived from its acceptance criteria.
 */
@Entity
@Table(name = "issues", uniqueConstraints = {
        @UniqueConstraint(name = "uq_issue_repo_number", columnNames = {"repo_id", "number"})
})
public class Issue {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "repo_id", nullable = false)
    private Repo repo;

    @Column(nullable = false)
    private Integer number;

    @Column(length = 1024)
    private String title;

    @Column(columnDefinition = "text")
    private String body;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IssueStatus status;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @OneToMany(mappedBy = "issue", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("itemKey ASC")
    private List<ChecklistItem> checklistItems = new ArrayList<>();

    protected Issue() {
    }

    public static Issue create(Repo repo, int number, String title, String body) {
        Issue i = new Issue();
        i.id = UUID.randomUUID();
        i.repo = repo;
        i.number = number;
        i.title = title;
        i.body = body;
        i.status = IssueStatus.PENDING;
        i.createdAt = Instant.now();
        i.updatedAt = i.createdAt;
        return i;
    }

    public void updateContent(String title, String body) {
        this.title = title;
        this.body = body;
        touch();
    }

    /**
     * Brings the checklist in line with {@code entries}, matching items by key. Items whose key
     * disappeared are removed. Returns whether the checklist changed.
     */
    public boolean syncChecklist(List<ChecklistEntry> entries) {
        Map<String, ChecklistEntry> incoming = entries.stream()
                .collect(Collectors.toMap(ChecklistEntry::key, Function.identity(), (a, b) -> a));
        boolean changed = false;

        Iterator<ChecklistItem> it = checklistItems.iterator();
        while (it.hasNext()) {
            ChecklistItem item = it.next();
            ChecklistEntry entry = incoming.remove(item.getItemKey());
            if (entry == null) {
                it.remove();
                changed = true;
            } else if (item.update(entry)) {
                changed = true;
            }
        }
        for (ChecklistEntry entry : entries) {
            if (incoming.remove(entry.key()) != null) {
                checklistItems.add(ChecklistItem.create(this, entry));
                changed = true;
            }
        }
        touch();
        return changed;
    }

    public void markProcessed() {
        this.status = IssueStatus.PROCESSED;
        touch();
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    public UUID getId() { return id; }
    public Repo getRepo() { return repo; }
    public Integer getNumber() { return number; }
    public String getTitle() { return title; }
    public String getBody() { return body; }
    public IssueStatus getStatus() { return status; }
    public List<ChecklistItem> getChecklistItems() { return List.copyOf(checklistItems); }
    public Instant getUpdatedAt() { return updatedAt; }
}
