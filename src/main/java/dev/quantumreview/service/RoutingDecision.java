package dev.quantumreview.service;

import dev.quantumreview.domain.event.RepoEvent;
import dev.quantumreview.job.JobIntent;

import java.util.List;

/**
 * What a webhook delivery should cause: jobs to enqueue and notifications to publish.
 * An empty decision means the event is ignored.
 */
public record RoutingDecision(List<JobIntent> jobs, List<RepoEvent> notifications) {

    private static final RoutingDecision IGNORED = new RoutingDecision(List.of(), List.of());

    public RoutingDecision {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }

    public static RoutingDecision ignored() {
        return IGNORED;
    }

    public static RoutingDecision of(JobIntent job) {
        return new RoutingDecision(List.of(job), List.of());
    }

    public boolean isIgnored() {
        return jobs.isEmpty() && notifications.isEmpty();
    }
}
