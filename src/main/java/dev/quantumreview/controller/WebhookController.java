package dev.quantumreview.controller;

import dev.quantumreview.job.JobHandle;
import dev.quantumreview.service.WebhookIngestionService;
import dev.quantumreview.service.WebhookResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * GitHub webhook receiver. The body is taken as raw bytes so the signature is checked against
 * exactly what GitHub signed. Returns as soon as the resulting jobs are enqueued.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    private final WebhookIngestionService ingestionService;

    public WebhookController(WebhookIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/github")
    public ResponseEntity<Map<String, Object>> handleWebhook(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventType,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature,
            @RequestBody(required = false) byte[] rawBody) {

        WebhookResult result = ingestionService.ingest(rawBody == null ? new byte[0] : rawBody,
                signature, deliveryId, eventType);

        return switch (result.outcome()) {
            case REJECTED -> ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "rejected", "reason", "invalid signature"));
            case DUPLICATE -> ResponseEntity.ok(Map.of("status", "duplicate", "reason", "delivery already processed"));
            case IGNORED -> ResponseEntity.ok(Map.of("status", "ignored", "reason", "event not tracked"));
            case ACCEPTED -> ResponseEntity.ok(Map.of("status", "accepted", "jobs", describe(result.jobs())));
        };
    }

    private static List<Map<String, String>> describe(List<JobHandle> handles) {
        return handles.stream()
                .map(h -> Map.of("jobId", h.jobId().toString(), "type", h.type().name()))
                .toList();
    }
}
