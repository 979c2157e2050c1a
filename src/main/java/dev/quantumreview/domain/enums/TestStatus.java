package dev.quantumreview.domain.enums;

public enum TestStatus {
    PASSED, FAILED, SKIPPED;

    /** Ordering used when one test id is reported more than once: a failure outranks everything. */
    public int severity() {
        return switch (this) {
            case FAILED -> 2;
            case PASSED -> 1;
            case SKIPPED -> 0;
        };
    }
}
