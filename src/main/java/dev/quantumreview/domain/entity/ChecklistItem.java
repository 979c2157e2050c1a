package dev.quantumreview.domain.entity;

import dev.quantumreview.domain.enums.ChecklistStatus;
import dev.quantumreview.domain.valueobject.ChecklistEntry;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "checklist_items", uniqueConstraints = {
        @UniqueConstraint(name = "uq_checklist_issue_key", columnNames = {"issue_id", "item_key"})
})
public class ChecklistItem {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "issue_id", nullable = false)
    private Issue issue;

    @Column(name = "item_key", nullable = false, length = 16)
    private String itemKey;

    @Column(name = "text", nullable = false, length = 2000)
    private String text;

    @Column(name = "required", nullable = false)
    private boolean required;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags", columnDefinition = "jsonb", nullable = false)
    private List<String> tags = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChecklistStatus status;

    protected ChecklistItem() {
    }

    static ChecklistItem create(Issue issue, ChecklistEntry entry) {
        ChecklistItem item = new ChecklistItem();
        item.id = UUID.randomUUID();
        item.issue = issue;
        item.itemKey = entry.key();
        item.text = entry.text();
        item.required = entry.required();
        item.tags = new ArrayList<>(entry.tags());
        item.status = ChecklistStatus.PENDING;
        return item;
    }

    /**
     * Applies a re-parsed entry with the same key. A changed text is a different criterion,
     * so its verdict is reset. Returns whether anything changed.
     */
    boolean update(ChecklistEntry entry) {
        boolean textChanged = !text.equals(entry.text());
        boolean changed = textChanged || required != entry.required() || !tags.equals(entry.tags());
        if (textChanged) {
            this.text = entry.text();
            this.status = ChecklistStatus.PENDING;
        }
        this.required = entry.required();
        this.tags = new ArrayList<>(entry.tags());
        return changed;
    }

    public void applyStatus(ChecklistStatus status) {
        this.status = status;
    }

    public UUID getId() { return id; }
    public Issue getIssue() { return issue; }
    public String getItemKey() { return itemKey; }
    public String getText() { return text; }
    public boolean isRequired() { return required; }
    public List<String> getTags() { return List.copyOf(tags); }
    public ChecklistStatus getStatus() { return status; }
}
