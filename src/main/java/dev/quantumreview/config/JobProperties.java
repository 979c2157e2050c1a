package dev.quantumreview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Job queue settings. {@code fifo} enables message groups keyed by the job partition key,
 * which serializes installation syncs across worker processes.
 */
@ConfigurationProperties(prefix = "quantumreview.jobs")
public record JobProperties(String queue,
                            boolean fifo,
                            int localConcurrency,
                            int localMaxAttempts,
                            Duration localRetryBackoff,
                            int payloadLogLimit) {
    public JobProperties {
        if (queue == null || queue.isBlank()) queue = "quantumreview-jobs";
        if (localConcurrency <= 0) localConcurrency = 4;
        if (localMaxAttempts <= 0) localMaxAttempts = 3;
        if (localRetryBackoff == null || localRetryBackoff.isNegative() || localRetryBackoff.isZero()) {
            localRetryBackoff = Duration.ofSeconds(2);
        }
        if (payloadLogLimit <= 0) payloadLogLimit = 500;
    }
}
