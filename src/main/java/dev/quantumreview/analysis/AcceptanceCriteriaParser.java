package dev.quantumreview.analysis;

import dev.quantumreview.domain.valueobject.ChecklistEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a checklist from an issue body.
 *
 * <p>Bullets under a {@code ## Acceptance Criteria} heading are used when the heading exists,
 * otherwise every bullet of the body. Within a bullet, {@code [optional]} clears the required
 * flag, {@code [required]} is dropped, and any other {@code [tag]} is collected as a tag.
 * Task-list boxes ({@code [ ]}, {@code [x]}) are ignored. Items are keyed C1..Cn in order.
 */
public final class AcceptanceCriteriaParser {

    private static final Pattern SECTION = Pattern.compile(
            "^##\\s*Acceptance\\s+Criteria\\s*$(.*?)(?=^##|\\z)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.MULTILINE);
    private static final Pattern BULLET = Pattern.compile("^[*\\-+]\\s+(.+)$");
    private static final Pattern TASK_BOX = Pattern.compile("^\\[[ xX]]\\s*");
    private static final Pattern OPTIONAL = Pattern.compile("\\[optional]", Pattern.CASE_INSENSITIVE);
    private static final Pattern REQUIRED = Pattern.compile("\\[required]", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("\\[([^\\]]+)]");
    private static final Pattern SPACES = Pattern.compile("\\s{2,}");

    private AcceptanceCriteriaParser() {
    }

    public static List<ChecklistEntry> parse(String body) {
        if (body == null || body.isBlank()) return List.of();
        String text = body.replace("\r\n", "\n");

        Matcher section = SECTION.matcher(text);
        String scope = section.find() ? section.group(1) : text;

        List<ChecklistEntry> entries = new ArrayList<>();
        for (String rawLine : scope.split("\n")) {
            Matcher bullet = BULLET.matcher(rawLine.strip());
            if (!bullet.matches()) continue;
            ChecklistEntry entry = toEntry("C" + (entries.size() + 1), bullet.group(1).strip());
            if (!entry.text().isEmpty()) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private static ChecklistEntry toEntry(String key, String bulletText) {
        String text = TASK_BOX.matcher(bulletText).replaceFirst("");
        boolean required = true;
        if (OPTIONAL.matcher(text).find()) {
            required = false;
            text = OPTIONAL.matcher(text).replaceAll("");
        } else {
            text = REQUIRED.matcher(text).replaceAll("");
        }

        List<String> tags = new ArrayList<>();
        Matcher tag = TAG.matcher(text);
        while (tag.find()) {
            String value = tag.group(1).strip();
            if (!value.isEmpty()) tags.add(value);
        }
        text = SPACES.matcher(TAG.matcher(text).replaceAll("")).replaceAll(" ").strip();
        return new ChecklistEntry(key, text, required, tags);
    }
}
