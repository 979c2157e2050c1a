package dev.quantumreview.domain.enums;

public enum IssueStatus { PENDING, PROCESSED }
