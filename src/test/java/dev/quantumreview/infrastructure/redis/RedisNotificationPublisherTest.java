package dev.quantumreview.infrastructure.redis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.config.NotificationProperties;
import dev.quantumreview.domain.event.RepoEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisNotificationPublisherTest {

    private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RedisNotificationPublisher publisher =
            new RedisNotificationPublisher(redisTemplate, objectMapper, new NotificationProperties(null));

    @Test
    @DisplayName("publishes {type, data + repo_id, timestamp} on broadcast:events")
    void publishesEnvelope() throws Exception {
        RepoEvent event = new RepoEvent(RepoEvent.CHECKLIST_READY, 555L,
                Map.of("issue_number", 12, "checklist_count", 3), Instant.parse("2026-03-01T12:00:00Z"));

        publisher.publish(event);

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq("broadcast:events"), message.capture());
        JsonNode json = objectMapper.readTree(message.getValue());
        assertThat(json.get("type").asText()).isEqualTo("checklist_ready");
        assertThat(json.at("/data/issue_number").asInt()).isEqualTo(12);
        assertThat(json.at("/data/repo_id").asLong()).isEqualTo(555L);
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-03-01T12:00:00Z");
    }

    @Test
    @DisplayName("a Redis outage never reaches the caller")
    void swallowsOutage() {
        doThrow(new RedisConnectionFailureException("down")).when(redisTemplate).convertAndSend(anyString(), anyString());

        assertThatCode(() -> publisher.publish(new RepoEvent(RepoEvent.PR_VALIDATED, 1L, Map.of(), Instant.now())))
                .doesNotThrowAnyException();
    }
}
