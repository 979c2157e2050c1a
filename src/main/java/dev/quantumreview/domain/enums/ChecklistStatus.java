package dev.quantumreview.domain.enums;

public enum ChecklistStatus { PENDING, PASSED, FAILED }
