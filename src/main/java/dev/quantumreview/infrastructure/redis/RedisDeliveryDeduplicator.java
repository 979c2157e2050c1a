package dev.quantumreview.infrastructure.redis;

import dev.quantumreview.config.WebhookProperties;
import dev.quantumreview.infrastructure.github.DeliveryDeduplicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Delivery de-duplication with a single {@code SET key value NX EX ttl}.
 *
 * <p>The test-and-set happens in one round-trip, so two concurrent deliveries of the same id
 * can never both observe "absent". The stored value is the first-seen timestamp. Redis
 * errors propagate: without the store we cannot tell a duplicate from a first delivery.
 */
@Component
public class RedisDeliveryDeduplicator implements DeliveryDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(RedisDeliveryDeduplicator.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;
    private final String keyPrefix;
    private final Clock clock;

    public RedisDeliveryDeduplicator(StringRedisTemplate redisTemplate, WebhookProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.deliveryTtl();
        this.keyPrefix = properties.deliveryKeyPrefix();
        this.clock = clock;
    }

    @Override
    public boolean isDuplicate(String deliveryId) {
        Boolean recorded = redisTemplate.opsForValue()
                .setIfAbsent(keyPrefix + deliveryId, clock.instant().toString(), ttl);
        boolean duplicate = !Boolean.TRUE.equals(recorded);
        if (duplicate) {
            log.debug("Delivery {} already recorded", deliveryId);
        }
        return duplicate;
    }

    @Override
    public void release(String deliveryId) {
        redisTemplate.delete(keyPrefix + deliveryId);
        log.info("Released delivery record {}", deliveryId);
    }
}
