package dev.quantumreview.infrastructure.redis;

import dev.quantumreview.config.WebhookProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisDeliveryDeduplicatorTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private RedisDeliveryDeduplicator deduplicator;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        deduplicator = new RedisDeliveryDeduplicator(redisTemplate, new WebhookProperties(null, null), clock);
    }

    @Test
    @DisplayName("first sighting records the id with a one hour TTL")
    void firstSightingIsRecorded() {
        when(valueOps.setIfAbsent(eq("webhook:delivery:abc-123"), anyString(), eq(Duration.ofHours(1)))).thenReturn(true);

        assertThat(deduplicator.isDuplicate("abc-123")).isFalse();
        verify(valueOps).setIfAbsent("webhook:delivery:abc-123", "2026-03-01T12:00:00Z", Duration.ofHours(1));
    }

    @Test
    @DisplayName("second sighting within the TTL is a duplicate and does not rewrite the key")
    void secondSightingIsDuplicate() {
        when(valueOps.setIfAbsent(eq("webhook:delivery:abc-123"), anyString(), any(Duration.class)))
                .thenReturn(true)
                .thenReturn(false);

        assertThat(deduplicator.isDuplicate("abc-123")).isFalse();
        assertThat(deduplicator.isDuplicate("abc-123")).isTrue();
        verify(valueOps, never()).set(anyString(), anyString(), any(Duration.class));
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("a null reply (pipelined or transactional connection) counts as a duplicate")
    void nullReplyIsDuplicate() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertThat(deduplicator.isDuplicate("abc-123")).isTrue();
    }

    @Test
    @DisplayName("release deletes the delivery record")
    void releaseDeletesKey() {
        deduplicator.release("abc-123");

        verify(redisTemplate).delete("webhook:delivery:abc-123");
    }
}
