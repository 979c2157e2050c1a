package dev.quantumreview.domain.valueobject;

import dev.quantumreview.domain.enums.TestStatus;

/**
 * A test case read from a JUnit XML report. {@code durationMs} is null when the report has no
 * usable {@code time} attribute.
 */
public record ParsedTestCase(String testId,
                             String name,
                             String classname,
                             TestStatus status,
                             Long durationMs,
                             String errorMessage) {}
