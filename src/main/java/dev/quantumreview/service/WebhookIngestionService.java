package dev.quantumreview.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.domain.event.RepoEvent;
import dev.quantumreview.exception.JobEnqueueException;
import dev.quantumreview.exception.MalformedPayloadException;
import dev.quantumreview.infrastructure.github.DeliveryDeduplicator;
import dev.quantumreview.infrastructure.github.WebhookSignatureVerifier;
import dev.quantumreview.job.Job;
import dev.quantumreview.job.JobHandle;
import dev.quantumreview.job.JobIntent;
import dev.quantumreview.job.JobQueue;
import dev.quantumreview.service.WebhookResult.Outcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Webhook pipeline: verify signature, parse, de-duplicate, route, enqueue.
 *
 * <p>Nothing past the signature check runs for an unsigned request, and a rejected request
 * leaves no delivery record behind. Jobs are enqueued, never executed, on the request thread.
 * If the queue refuses a job the delivery record is released and the failure propagates, so
 * GitHub's redelivery is processed normally.
 */
@Service
public class WebhookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

    private final WebhookSignatureVerifier signatureVerifier;
    private final DeliveryDeduplicator deduplicator;
    private final GitHubEventRouter router;
    private final JobQueue jobQueue;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public WebhookIngestionService(WebhookSignatureVerifier signatureVerifier,
                                   DeliveryDeduplicator deduplicator,
                                   GitHubEventRouter router,
                                   JobQueue jobQueue,
                                   ApplicationEventPublisher eventPublisher,
                                   ObjectMapper objectMapper,
                                   MeterRegistry meterRegistry,
                                   Clock clock) {
        this.signatureVerifier = signatureVerifier;
        this.deduplicator = deduplicator;
        this.router = router;
        this.jobQueue = jobQueue;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * @throws MalformedPayloadException if a correctly signed body is not a JSON object
     * @throws JobEnqueueException       if the job queue did not accept a job
     */
    public WebhookResult ingest(byte[] rawBody, String signature, String deliveryId, String eventType) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("deliveryId", deliveryId == null ? "-" : deliveryId)) {
            if (!signatureVerifier.verify(rawBody, signature)) {
                log.warn("Webhook signature verification failed for delivery={} event={}", deliveryId, eventType);
                count(Outcome.REJECTED.name());
                return WebhookResult.of(Outcome.REJECTED);
            }

            JsonNode payload = parse(rawBody);
            String action = payload.path("action").isTextual() ? payload.get("action").asText() : null;
            log.info("Webhook: event={}, action={}, delivery={}", eventType, action, deliveryId);

            boolean recorded = false;
            if (deliveryId == null || deliveryId.isBlank()) {
                log.warn("Delivery without X-GitHub-Delivery header, de-duplication skipped");
            } else if (deduplicator.isDuplicate(deliveryId)) {
                log.info("Duplicate delivery {} skipped", deliveryId);
                count(Outcome.DUPLICATE.name());
                return WebhookResult.of(Outcome.DUPLICATE);
            } else {
                recorded = true;
            }

            RoutingDecision decision = router.route(eventType, action, payload);
            if (decision.isIgnored()) {
                count(Outcome.IGNORED.name());
                return WebhookResult.of(Outcome.IGNORED);
            }

            List<JobHandle> handles = new ArrayList<>();
            try {
                for (JobIntent intent : decision.jobs()) {
                    JobHandle handle = jobQueue.enqueue(Job.of(intent, payload, deliveryId, clock.instant()));
                    log.info("Enqueued job {} ({}) partition={}", handle.jobId(), handle.type(), intent.partitionKey());
                    handles.add(handle);
                }
            } catch (JobEnqueueException e) {
                if (recorded) {
                    deduplicator.release(deliveryId);
                }
                count("enqueue_failed");
                throw e;
            }

            for (RepoEvent notification : decision.notifications()) {
                eventPublisher.publishEvent(notification);
            }
            count(Outcome.ACCEPTED.name());
            return new WebhookResult(Outcome.ACCEPTED, handles);
        }
    }

    private JsonNode parse(byte[] rawBody) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            count("malformed");
            throw new MalformedPayloadException("Webhook body is not valid JSON", e);
        }
        if (payload == null || !payload.isObject()) {
            count("malformed");
            throw new MalformedPayloadException("Webhook body is not a JSON object");
        }
        return payload;
    }

    private void count(String outcome) {
        Counter.builder("quantumreview.webhook.deliveries")
                .description("Webhook deliveries by outcome")
                .tag("outcome", outcome.toLowerCase())
                .register(meterRegistry)
                .increment();
    }
}
