package dev.quantumreview.domain.valueobject;

import java.util.List;

/**
 * One acceptance criterion parsed from an issue body. {@code key} is C1..Cn in document order.
 */
public record ChecklistEntry(String key, String text, boolean required, List<String> tags) {
    public ChecklistEntry {
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key required");
        if (text == null) text = "";
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
