package dev.quantumreview.job.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Binds a job's webhook payload to its typed view. A payload that does not bind is logged
 * and reported as empty: redelivering it cannot help.
 */
final class JobPayloads {

    private static final Logger log = LoggerFactory.getLogger(JobPayloads.class);

    private JobPayloads() {
    }

    static <T> Optional<T> read(ObjectMapper objectMapper, Job job, Class<T> type) {
        try {
            return Optional.ofNullable(objectMapper.convertValue(job.payload(), type));
        } catch (IllegalArgumentException e) {
            log.error("Job {} ({}) payload does not match {}: {}", job.id(), job.type(), type.getSimpleName(), e.getMessage());
            return Optional.empty();
        }
    }
}
