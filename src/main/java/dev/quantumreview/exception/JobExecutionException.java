package dev.quantumreview.exception;

import dev.quantumreview.job.JobType;

import java.util.UUID;

/**
 * A job handler failed. Its transaction has been rolled back; the exception is rethrown
 * so the queue's redelivery policy applies.
 */
public class JobExecutionException extends RuntimeException {

    private final UUID jobId;
    private final JobType jobType;

    public JobExecutionException(UUID jobId, JobType jobType, Throwable cause) {
        super("Job %s (%s) failed: %s".formatted(jobId, jobType, cause.getMessage()), cause);
        this.jobId = jobId;
        this.jobType = jobType;
    }

    public UUID getJobId() {
        return jobId;
    }

    public JobType getJobType() {
        return jobType;
    }
}
