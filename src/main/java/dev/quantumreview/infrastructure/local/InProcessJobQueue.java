package dev.quantumreview.infrastructure.local;

import dev.quantumreview.config.JobProperties;
import dev.quantumreview.exception.JobEnqueueException;
import dev.quantumreview.exception.JobExecutionException;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobDispatcher;
import dev.quantumreview.job.JobHandle;
import dev.quantumreview.job.JobQueue;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Local-development queue: jobs run on the {@code jobTaskExecutor} pool of this process.
 * A failed job is retried up to {@code quantumreview.jobs.local-max-attempts} times with
 * exponential backoff starting at {@code local-retry-backoff}, then dropped with an error log.
 * Jobs still queued are lost on shutdown.
 */
@Component
@Profile("local")
public class InProcessJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(InProcessJobQueue.class);

    private final ThreadPoolTaskExecutor executor;
    private final JobDispatcher dispatcher;
    private final RetryConfig retryConfig;

    public InProcessJobQueue(@Qualifier("jobTaskExecutor") ThreadPoolTaskExecutor executor,
                             JobDispatcher dispatcher,
                             JobProperties properties) {
        this.executor = executor;
        this.dispatcher = dispatcher;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(properties.localMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(properties.localRetryBackoff(), 2.0))
                .retryExceptions(JobExecutionException.class)
                .build();
    }

    @Override
    public JobHandle enqueue(Job job) {
        try {
            executor.execute(() -> runWithRetry(job));
        } catch (TaskRejectedException e) {
            throw new JobEnqueueException(job.type(), "Local job pool rejected job " + job.id(), e);
        }
        return new JobHandle(job.id(), job.type(), null);
    }

    void runWithRetry(Job job) {
        Retry retry = Retry.of("local-job-" + job.id(), retryConfig);
        retry.getEventPublisher().onRetry(e -> log.warn("Job {} ({}) failed on attempt {}/{}, retrying in {} ms",
                job.id(), job.type(), e.getNumberOfRetryAttempts(), retryConfig.getMaxAttempts(),
                e.getWaitInterval().toMillis()));
        try {
            retry.executeRunnable(() -> dispatcher.execute(job));
        } catch (JobExecutionException e) {
            log.error("Job {} ({}) failed after {} attempts, giving up", job.id(), job.type(), retryConfig.getMaxAttempts(), e);
        }
    }
}
