package dev.quantumreview.job;

import dev.quantumreview.config.JobProperties;
import dev.quantumreview.exception.JobExecutionException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes jobs delivered by any {@link JobQueue} transport.
 *
 * <p>Execution contract:
 * <ul>
 *   <li>Handlers are looked up in an {@link EnumMap}; a {@link JobType} without a handler
 *       (or with two) fails construction.</li>
 *   <li>Each job gets its own {@code REQUIRES_NEW} transaction. A failing job rolls back
 *       only its own writes.</li>
 *   <li>On failure the error is logged with job type, id and a truncated payload, then
 *       rethrown as {@link JobExecutionException} so the transport can redeliver.</li>
 *   <li>Jobs sharing a partition key run one at a time in this process. Keys are mapped
 *       onto a fixed set of lock stripes.</li>
 * </ul>
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);
    private static final int LOCK_STRIPES = 64;

    private final Map<JobType, JobHandler> handlers;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final int payloadLogLimit;
    private final ReentrantLock[] partitionLocks = new ReentrantLock[LOCK_STRIPES];

    public JobDispatcher(List<JobHandler> handlers,
                         PlatformTransactionManager transactionManager,
                         MeterRegistry meterRegistry,
                         JobProperties jobProperties) {
        this.handlers = indexHandlers(handlers);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.meterRegistry = meterRegistry;
        this.payloadLogLimit = jobProperties.payloadLogLimit();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            partitionLocks[i] = new ReentrantLock();
        }
    }

    public void execute(Job job) {
        JobHandler handler = handlers.get(job.type());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        ReentrantLock lock = lockFor(job.partitionKey());

        MDC.put("jobId", job.id().toString());
        MDC.put("jobType", job.type().name());
        if (job.deliveryId() != null) {
            MDC.put("deliveryId", job.deliveryId());
        }
        lock.lock();
        try {
            log.info("Executing job {} ({}) partition={}", job.id(), job.type(), job.partitionKey());
            transactionTemplate.executeWithoutResult(status -> handler.handle(job));
            log.info("Job {} ({}) completed", job.id(), job.type());
        } catch (RuntimeException e) {
            outcome = "failure";
            log.error("Job {} ({}) failed, transaction rolled back; payload={}",
                    job.id(), job.type(), truncate(job.payload().toString()), e);
            throw new JobExecutionException(job.id(), job.type(), e);
        } finally {
            lock.unlock();
            sample.stop(Timer.builder("quantumreview.jobs.duration")
                    .description("Job execution time")
                    .tag("type", job.type().name())
                    .tag("outcome", outcome)
                    .register(meterRegistry));
            MDC.remove("jobId");
            MDC.remove("jobType");
            MDC.remove("deliveryId");
        }
    }

    Set<JobType> supportedTypes() {
        return handlers.keySet();
    }

    private ReentrantLock lockFor(String partitionKey) {
        return partitionLocks[Math.floorMod(partitionKey.hashCode(), LOCK_STRIPES)];
    }

    private String truncate(String payload) {
        if (payload.length() <= payloadLogLimit) return payload;
        return payload.substring(0, payloadLogLimit) + "...(" + payload.length() + " chars)";
    }

    private static Map<JobType, JobHandler> indexHandlers(List<JobHandler> handlers) {
        Map<JobType, JobHandler> index = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobHandler previous = index.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers for %s: %s and %s".formatted(
                        handler.type(), previous.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
        }
        Set<JobType> missing = EnumSet.allOf(JobType.class);
        missing.removeAll(index.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for job types " + missing);
        }
        return index;
    }
}
