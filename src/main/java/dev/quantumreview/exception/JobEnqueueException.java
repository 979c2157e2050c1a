package dev.quantumreview.exception;

import dev.quantumreview.job.JobType;

/**
 * The job queue did not acknowledge a job. Surfaced to GitHub as 503 so it redelivers.
 */
public class JobEnqueueException extends RuntimeException {

    private final JobType jobType;

    public JobEnqueueException(JobType jobType, String message, Throwable cause) {
        super(message, cause);
        this.jobType = jobType;
    }

    public JobType getJobType() {
        return jobType;
    }
}
