package dev.quantumreview.analysis;

import dev.quantumreview.domain.valueobject.ChecklistEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AcceptanceCriteriaParserTest {

    @Test
    @DisplayName("only bullets under the Acceptance Criteria heading are used")
    void readsSectionOnly() {
        String body = """
                Cart totals are wrong for discounted items.

                - not a criterion, this is context

                ## Acceptance Criteria
                - Totals include tax
                * Discounts apply before tax [pricing]
                + [x] Empty cart shows zero [optional]

                ## Notes
                - also not a criterion
                """;

        List<ChecklistEntry> entries = AcceptanceCriteriaParser.parse(body);

        assertThat(entries).extracting(ChecklistEntry::key).containsExactly("C1", "C2", "C3");
        assertThat(entries.get(0)).isEqualTo(new ChecklistEntry("C1", "Totals include tax", true, List.of()));
        assertThat(entries.get(1)).isEqualTo(
                new ChecklistEntry("C2", "Discounts apply before tax", true, List.of("pricing")));
        assertThat(entries.get(2)).isEqualTo(new ChecklistEntry("C3", "Empty cart shows zero", false, List.of()));
    }

    @Test
    @DisplayName("without the heading every bullet counts")
    void fallsBackToAllBullets() {
        String body = "Some text\r\n- first [required]\r\n  - nested [UI] [a11y]\r\nplain line\r\n";

        List<ChecklistEntry> entries = AcceptanceCriteriaParser.parse(body);

        assertThat(entries).containsExactly(
                new ChecklistEntry("C1", "first", true, List.of()),
                new ChecklistEntry("C2", "nested", true, List.of("UI", "a11y")));
    }

    @Test
    @DisplayName("the heading is matched case-insensitively")
    void headingCaseInsensitive() {
        String body = "## acceptance criteria\n- one\n";

        assertThat(AcceptanceCriteriaParser.parse(body)).extracting(ChecklistEntry::text).containsExactly("one");
    }

    @Test
    @DisplayName("bullets that are only tags are dropped and keys stay contiguous")
    void skipsEmptyBullets() {
        String body = "- [ ] [optional]\n- real item\n";

        assertThat(AcceptanceCriteriaParser.parse(body))
                .containsExactly(new ChecklistEntry("C1", "real item", true, List.of()));
    }

    @Test
    void emptyBodies() {
        assertThat(AcceptanceCriteriaParser.parse(null)).isEmpty();
        assertThat(AcceptanceCriteriaParser.parse("   ")).isEmpty();
        assertThat(AcceptanceCriteriaParser.parse("no bullets here")).isEmpty();
    }
}
