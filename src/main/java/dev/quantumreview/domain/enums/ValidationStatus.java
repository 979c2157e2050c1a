package dev.quantumreview.domain.enums;

/**
 * CI verdict for a pull request. {@code VALIDATED} requires at least one test result and
 * every result passed.
 */
public enum ValidationStatus { PENDING, VALIDATED, NEEDS_WORK }
