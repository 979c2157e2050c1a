package dev.quantumreview.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Suggested tests for a pull request, stored as JSON on the pull request row:
 * {@code {"tests":[{"test_id","name","framework","target_file","checklist_ids"}]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestManifest(List<Entry> tests) {

    public TestManifest {
        tests = tests == null ? List.of() : List.copyOf(tests);
    }

    public static TestManifest empty() {
        return new TestManifest(List.of());
    }

    public Map<String, Entry> byTestId() {
        return tests.stream().collect(Collectors.toMap(Entry::testId, Function.identity(), (a, b) -> a));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(@JsonProperty("test_id") String testId,
                        String name,
                        String framework,
                        @JsonProperty("target_file") String targetFile,
                        @JsonProperty("checklist_ids") List<String> checklistIds) {
        public Entry {
            checklistIds = checklistIds == null ? List.of() : List.copyOf(checklistIds);
        }
    }
}
