package dev.quantumreview.job;

import dev.quantumreview.exception.JobEnqueueException;

/**
 * Asynchronous boundary between the webhook request and job execution. {@link #enqueue}
 * returns once the transport has accepted the job; it never waits for the job to run.
 */
public interface JobQueue {

    /**
     * @throws JobEnqueueException if the transport did not accept the job
     */
    JobHandle enqueue(Job job);
}
