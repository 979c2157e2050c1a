package dev.quantumreview.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "quantumreview.notifications")
public record NotificationProperties(String broadcastChannel) {
    public NotificationProperties {
        if (broadcastChannel == null || broadcastChannel.isBlank()) broadcastChannel = "broadcast:events";
    }
}
