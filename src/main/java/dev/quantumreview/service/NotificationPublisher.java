package dev.quantumreview.service;

import dev.quantumreview.domain.event.RepoEvent;

/**
 * Outbound side of the real-time notification channel. Delivery is best effort.
 */
public interface NotificationPublisher {
    void publish(RepoEvent event);
}
