package dev.quantumreview.analysis;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the issue a pull request refers to. A closing keyword ({@code closes #12},
 * {@code fixes #12}, {@code resolves #12}) wins over a bare {@code #12}.
 */
public final class IssueReferences {

    private static final Pattern CLOSING = Pattern.compile(
            "\\b(?:close[sd]?|fix(?:e[sd])?|resolve[sd]?)\\s*:?\\s+#(\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE = Pattern.compile("(?<![\\w/&])#(\\d+)\\b");

    private IssueReferences() {
    }

    public static Optional<Integer> linkedIssueNumber(String body) {
        if (body == null || body.isEmpty()) return Optional.empty();
        Matcher closing = CLOSING.matcher(body);
        if (closing.find()) return toNumber(closing.group(1));
        Matcher bare = BARE.matcher(body);
        return bare.find() ? toNumber(bare.group(1)) : Optional.empty();
    }

    private static Optional<Integer> toNumber(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
