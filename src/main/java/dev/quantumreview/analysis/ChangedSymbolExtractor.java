package dev.quantumreview.analysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic extraction of function and class names declared on the added lines of a unified diff.
 * Supports Python, JavaScript/TypeScript, Java and Kotlin; other files yield nothing.
 */
public final class ChangedSymbolExtractor {

    public enum Language {
        PYTHON("pytest"), JAVASCRIPT("jest"), JAVA("junit"), KOTLIN("junit"), OTHER("unknown");

        private final String testFramework;

        Language(String testFramework) {
            this.testFramework = testFramework;
        }

        public String testFramework() {
            return testFramework;
        }
    }

    private static final List<Pattern> PYTHON = List.of(
            Pattern.compile("\\b(?:def|class)\\s+(\\w+)"));

    private static final List<Pattern> JAVASCRIPT = List.of(
            Pattern.compile("\\b(?:function\\*?|class)\\s+(\\w+)"),
            Pattern.compile("\\b(?:const|let|var)\\s+(\\w+)\\s*=\\s*(?:async\\s+)?(?:\\(|function|class|\\w+\\s*=>)"),
            Pattern.compile("\\bexport\\s+(?:default\\s+)?(?:async\\s+)?(?:function|class|const|let)\\s+(\\w+)"));

    private static final List<Pattern> JAVA = List.of(
            Pattern.compile("\\b(?:class|interface|enum|record)\\s+(\\w+)"),
            Pattern.compile("^\\s*(?:@\\w+\\s+)*(?:(?:public|protected|private|static|final|abstract|synchronized|default)\\s+)*"
                    + "(?:<[^>]+>\\s+)?[\\w.$]+(?:<[^()]*>)?(?:\\[])*\\s+(\\w+)\\s*\\([^;]*$"));

    private static final List<Pattern> KOTLIN = List.of(
            Pattern.compile("\\b(?:class|interface|object)\\s+(\\w+)"),
            Pattern.compile("\\bfun\\s+(?:<[^>]+>\\s*)?(?:[\\w.]+\\.)?(\\w+)\\s*\\("));

    private static final Set<String> NOT_NAMES = Set.of(
            "if", "for", "while", "switch", "catch", "return", "new", "else", "throw", "synchronized", "super", "this");

    private ChangedSymbolExtractor() {
    }

    public static Language languageOf(String filePath) {
        if (filePath == null) return Language.OTHER;
        int dot = filePath.lastIndexOf('.');
        String ext = dot < 0 ? "" : filePath.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (ext) {
            case "py" -> Language.PYTHON;
            case "js", "jsx", "ts", "tsx", "mjs", "cjs" -> Language.JAVASCRIPT;
            case "java" -> Language.JAVA;
            case "kt", "kts" -> Language.KOTLIN;
            default -> Language.OTHER;
        };
    }

    /**
     * Returns symbol names in first-seen order, without duplicates.
     */
    public static List<String> extract(String patch, String filePath) {
        if (patch == null || patch.isEmpty()) return List.of();
        List<Pattern> patterns = switch (languageOf(filePath)) {
            case PYTHON -> PYTHON;
            case JAVASCRIPT -> JAVASCRIPT;
            case JAVA -> JAVA;
            case KOTLIN -> KOTLIN;
            case OTHER -> List.of();
        };
        if (patterns.isEmpty()) return List.of();

        Set<String> symbols = new LinkedHashSet<>();
        for (String line : patch.split("\n")) {
            if (!line.startsWith("+") || line.startsWith("+++")) continue;
            String added = line.substring(1);
            for (Pattern pattern : patterns) {
                Matcher m = pattern.matcher(added);
                while (m.find()) {
                    String name = m.group(1);
                    if (!NOT_NAMES.contains(name)) symbols.add(name);
                }
            }
        }
        return List.copyOf(symbols);
    }
}
