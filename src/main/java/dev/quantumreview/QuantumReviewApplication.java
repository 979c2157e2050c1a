package dev.quantumreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * QuantumReview backend: GitHub App webhook ingestion and background job pipeline.
 *
 * <pre>
 * GitHub Webhook → WebhookController → WebhookIngestionService (verify, parse, dedupe)
 *   → GitHubEventRouter → JobQueue (SQS | in-process) → JobDispatcher → JobHandler
 *   → GitHubApiClient (installation token from GitHubTokenProvider)
 * </pre>
 *
 * <p>Webhooks are answered as soon as the job is enqueued; everything that touches the
 * GitHub API or the database runs on the worker side.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QuantumReviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantumReviewApplication.class, args);
    }
}
