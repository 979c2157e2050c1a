package dev.quantumreview.infrastructure.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobDispatcher;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * SQS consumer for job envelopes.
 *
 * <p>If the dispatcher throws, the message is not acknowledged and SQS redelivers it after
 * the visibility timeout; after the queue's maxReceiveCount it moves to the dead-letter queue.
 * Envelopes that cannot be parsed are acknowledged and logged, since they can never succeed.
 */
@Component
@Profile("!local")
public class SqsJobListener {

    private static final Logger log = LoggerFactory.getLogger(SqsJobListener.class);

    private final JobDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public SqsJobListener(JobDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @SqsListener(value = "${quantumreview.jobs.queue}", maxConcurrentMessages = "5", maxMessagesPerPoll = "5")
    public void onJob(String message) {
        Job job;
        try {
            job = objectMapper.readValue(message, Job.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Discarding unreadable job message: {}", e.getMessage());
            return;
        }
        dispatcher.execute(job);
    }
}
