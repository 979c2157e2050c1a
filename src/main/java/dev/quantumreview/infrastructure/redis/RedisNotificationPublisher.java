package dev.quantumreview.infrastructure.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.config.NotificationProperties;
import dev.quantumreview.domain.event.RepoEvent;
import dev.quantumreview.service.NotificationPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes {@code {"type", "data", "timestamp"}} messages on the broadcast channel. The SSE
 * fan-out subscribes to that channel. Publish failures are logged and dropped: a missed
 * notification must never fail the job that produced it.
 */
@Component
public class RedisNotificationPublisher implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(RedisNotificationPublisher.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public RedisNotificationPublisher(StringRedisTemplate redisTemplate,
                                      ObjectMapper objectMapper,
                                      NotificationProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channel = properties.broadcastChannel();
    }

    @Override
    public void publish(RepoEvent event) {
        try {
            redisTemplate.convertAndSend(channel, toMessage(event));
            log.debug("Published {} for repo {} on {}", event.type(), event.repoId(), channel);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to publish {} for repo {}", event.type(), event.repoId(), e);
        }
    }

    String toMessage(RepoEvent event) throws JsonProcessingException {
        Map<String, Object> data = new LinkedHashMap<>(event.data());
        data.put("repo_id", event.repoId());
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", event.type());
        message.put("data", data);
        message.put("timestamp", event.occurredAt() == null ? null : event.occurredAt().toString());
        return objectMapper.writeValueAsString(message);
    }
}
