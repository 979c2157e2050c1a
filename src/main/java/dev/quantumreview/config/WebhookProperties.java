package dev.quantumreview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "quantumreview.webhook")
public record WebhookProperties(Duration deliveryTtl, String deliveryKeyPrefix) {
    public WebhookProperties {
        if (deliveryTtl == null || deliveryTtl.isZero() || deliveryTtl.isNegative()) deliveryTtl = Duration.ofHours(1);
        if (deliveryKeyPrefix == null || deliveryKeyPrefix.isBlank()) deliveryKeyPrefix = "webhook:delivery:";
    }
}
