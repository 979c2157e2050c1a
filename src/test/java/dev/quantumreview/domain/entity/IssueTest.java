package dev.quantumreview.domain.entity;

import dev.quantumreview.domain.enums.ChecklistStatus;
import dev.quantumreview.domain.valueobject.ChecklistEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IssueTest {

    private Issue issue;

    @BeforeEach
    void setUp() {
        issue = Issue.create(Repo.create("acme/shop", 555L), 12, "Cart totals", "body");
    }

    @Test
    @DisplayName("first sync creates pending items in order")
    void createsItems() {
        boolean changed = issue.syncChecklist(List.of(entry("C1", "Totals include tax"), entry("C2", "Discounts apply")));

        assertThat(changed).isTrue();
        assertThat(issue.getChecklistItems()).extracting(ChecklistItem::getItemKey).containsExactly("C1", "C2");
        assertThat(issue.getChecklistItems()).allSatisfy(item -> {
            assertThat(item.getStatus()).isEqualTo(ChecklistStatus.PENDING);
            assertThat(item.getIssue()).isSameAs(issue);
        });
    }

    @Test
    @DisplayName("re-syncing the same entries changes nothing and keeps item identity")
    void idempotent() {
        List<ChecklistEntry> entries = List.of(entry("C1", "Totals include tax"), entry("C2", "Discounts apply"));
        issue.syncChecklist(entries);
        List<ChecklistItem> before = issue.getChecklistItems();
        before.get(0).applyStatus(ChecklistStatus.PASSED);

        boolean changed = issue.syncChecklist(entries);

        assertThat(changed).isFalse();
        assertThat(issue.getChecklistItems()).containsExactlyElementsOf(before);
        assertThat(issue.getChecklistItems().get(0).getStatus()).isEqualTo(ChecklistStatus.PASSED);
    }

    @Test
    @DisplayName("edited text resets the verdict, removed keys disappear, new keys are added")
    void convergesOnEdit() {
        issue.syncChecklist(List.of(entry("C1", "Totals include tax"), entry("C2", "Discounts apply")));
        issue.getChecklistItems().forEach(item -> item.applyStatus(ChecklistStatus.PASSED));

        boolean changed = issue.syncChecklist(List.of(
                entry("C1", "Totals include sales tax"),
                new ChecklistEntry("C3", "Shipping is free over 50", false, List.of("shipping"))));

        assertThat(changed).isTrue();
        assertThat(issue.getChecklistItems()).extracting(ChecklistItem::getItemKey).containsExactly("C1", "C3");
        ChecklistItem c1 = issue.getChecklistItems().get(0);
        assertThat(c1.getText()).isEqualTo("Totals include sales tax");
        assertThat(c1.getStatus()).isEqualTo(ChecklistStatus.PENDING);
        ChecklistItem c3 = issue.getChecklistItems().get(1);
        assertThat(c3.isRequired()).isFalse();
        assertThat(c3.getTags()).containsExactly("shipping");
    }

    @Test
    @DisplayName("a tag-only change is a change but keeps the verdict")
    void tagChangeKeepsVerdict() {
        issue.syncChecklist(List.of(entry("C1", "Totals include tax")));
        issue.getChecklistItems().get(0).applyStatus(ChecklistStatus.FAILED);

        boolean changed = issue.syncChecklist(List.of(new ChecklistEntry("C1", "Totals include tax", true, List.of("pricing"))));

        assertThat(changed).isTrue();
        assertThat(issue.getChecklistItems().get(0).getStatus()).isEqualTo(ChecklistStatus.FAILED);
    }

    @Test
    void emptyEntriesClearTheChecklist() {
        issue.syncChecklist(List.of(entry("C1", "Totals include tax")));

        assertThat(issue.syncChecklist(List.of())).isTrue();
        assertThat(issue.getChecklistItems()).isEmpty();
    }

    private static ChecklistEntry entry(String key, String text) {
        return new ChecklistEntry(key, text, true, List.of());
    }
}
