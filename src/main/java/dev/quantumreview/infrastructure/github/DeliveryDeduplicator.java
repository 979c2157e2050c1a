package dev.quantumreview.infrastructure.github;

/**
 * Remembers webhook delivery ids for a TTL window.
 */
public interface DeliveryDeduplicator {

    /**
     * Atomically records {@code deliveryId} if absent. Returns {@code false} the first time an id is
     * seen within the window, {@code true} afterwards. A duplicate hit does not extend the window.
     */
    boolean isDuplicate(String deliveryId);

    /**
     * Forgets a delivery id so a redelivery is processed again. Used when the job could not be enqueued.
     */
    void release(String deliveryId);
}
