package dev.quantumreview.job;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Job envelope as it travels through the queue.
 *
 * <p>The payload is the originating webhook payload, unchanged. Handlers read identifiers
 * from it and fetch everything mutable from GitHub or the database at execution time.
 */
public record Job(UUID id,
                  JobType type,
                  JsonNode payload,
                  String deliveryId,
                  String partitionKey,
                  Instant enqueuedAt) {

    public static final String UNPARTITIONED = "unpartitioned";

    public Job {
        if (id == null) throw new IllegalArgumentException("id required");
        if (type == null) throw new IllegalArgumentException("type required");
        if (payload == null) throw new IllegalArgumentException("payload required");
        if (partitionKey == null || partitionKey.isBlank()) partitionKey = UNPARTITIONED;
    }

    public static Job of(JobIntent intent, JsonNode payload, String deliveryId, Instant now) {
        return new Job(UUID.randomUUID(), intent.type(), payload, deliveryId, intent.partitionKey(), now);
    }
}
