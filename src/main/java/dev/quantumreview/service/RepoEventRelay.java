package dev.quantumreview.service;

import dev.quantumreview.domain.event.RepoEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards {@link RepoEvent}s to the notification channel once the job transaction has
 * committed. Events published outside a transaction (webhook ingestion) are forwarded
 * immediately.
 */
@Component
public class RepoEventRelay {

    private final NotificationPublisher publisher;

    public RepoEventRelay(NotificationPublisher publisher) {
        this.publisher = publisher;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRepoEvent(RepoEvent event) {
        publisher.publish(event);
    }
}
