package dev.quantumreview.service;

import dev.quantumreview.job.JobHandle;

import java.util.List;

/**
 * Outcome of one webhook delivery.
 */
public record WebhookResult(Outcome outcome, List<JobHandle> jobs) {

    public enum Outcome { ACCEPTED, IGNORED, DUPLICATE, REJECTED }

    public WebhookResult {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public static WebhookResult of(Outcome outcome) {
        return new WebhookResult(outcome, List.of());
    }
}
