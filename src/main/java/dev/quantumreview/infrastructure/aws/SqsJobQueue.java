package dev.quantumreview.infrastructure.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.config.JobProperties;
import dev.quantumreview.exception.JobEnqueueException;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobHandle;
import dev.quantumreview.job.JobQueue;
import io.awspring.cloud.sqs.operations.SendResult;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Sends jobs to SQS as JSON envelopes.
 *
 * <p>On a FIFO queue the partition key becomes the message group id, so SQS delivers jobs of
 * one installation or repository one at a time across all workers. The job id doubles as the
 * deduplication id.
 */
@Component
@Profile("!local")
public class SqsJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(SqsJobQueue.class);

    private final SqsTemplate sqsTemplate;
    private final ObjectMapper objectMapper;
    private final String queueName;
    private final boolean fifo;

    public SqsJobQueue(SqsTemplate sqsTemplate, ObjectMapper objectMapper, JobProperties properties) {
        this.sqsTemplate = sqsTemplate;
        this.objectMapper = objectMapper;
        this.queueName = properties.queue();
        this.fifo = properties.fifo();
    }

    @Override
    public JobHandle enqueue(Job job) {
        String body;
        try {
            body = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new JobEnqueueException(job.type(), "Cannot serialize job " + job.id(), e);
        }
        try {
            SendResult<String> result = sqsTemplate.send(to -> {
                to.queue(queueName).payload(body);
                if (fifo) {
                    to.messageGroupId(job.partitionKey()).messageDeduplicationId(job.id().toString());
                }
            });
            log.debug("Job {} ({}) sent to {} as message {}", job.id(), job.type(), queueName, result.messageId());
            return new JobHandle(job.id(), job.type(), String.valueOf(result.messageId()));
        } catch (RuntimeException e) {
            throw new JobEnqueueException(job.type(), "SQS send failed for job " + job.id(), e);
        }
    }
}
