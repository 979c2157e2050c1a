package dev.quantumreview.job;

import java.util.UUID;

/**
 * Enqueue acknowledgment. {@code messageId} is the transport's own id when it has one.
 */
public record JobHandle(UUID jobId, JobType type, String messageId) {}
