package dev.quantumreview.analysis;

import dev.quantumreview.analysis.ChangedSymbolExtractor.Language;
import dev.quantumreview.domain.valueobject.TestManifest;
import dev.quantumreview.dto.github.PullRequestFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the changed symbols of a pull request into suggested tests, T1..Tn in file order.
 * A test is linked to every checklist item whose text mentions the symbol (case-insensitive).
 */
public final class TestManifestBuilder {

    private TestManifestBuilder() {
    }

    /**
     * @param checklist item key to item text, in checklist order
     */
    public static TestManifest build(List<PullRequestFile> files, Map<String, String> checklist) {
        List<TestManifest.Entry> tests = new ArrayList<>();
        for (PullRequestFile file : files) {
            if (file.filename() == null || file.patch() == null || file.patch().isEmpty()) continue;
            Language language = ChangedSymbolExtractor.languageOf(file.filename());
            for (String symbol : ChangedSymbolExtractor.extract(file.patch(), file.filename())) {
                String needle = symbol.toLowerCase(Locale.ROOT);
                List<String> checklistIds = checklist.entrySet().stream()
                        .filter(e -> e.getValue() != null && e.getValue().toLowerCase(Locale.ROOT).contains(needle))
                        .map(Map.Entry::getKey)
                        .toList();
                tests.add(new TestManifest.Entry("T" + (tests.size() + 1), "test_" + needle,
                        language.testFramework(), file.filename(), checklistIds));
            }
        }
        return new TestManifest(tests);
    }
}
