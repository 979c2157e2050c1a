package dev.quantumreview.job;

/**
 * Router output: which job to run and which partition it belongs to.
 * The payload is the webhook payload itself and is attached by the caller.
 */
public record JobIntent(JobType type, String partitionKey) {
    public JobIntent {
        if (type == null) throw new IllegalArgumentException("type required");
        if (partitionKey == null || partitionKey.isBlank()) partitionKey = Job.UNPARTITIONED;
    }
}
