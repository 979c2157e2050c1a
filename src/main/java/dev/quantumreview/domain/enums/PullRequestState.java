package dev.quantumreview.domain.enums;

public enum PullRequestState { OPEN, CLOSED, MERGED }
