package dev.quantumreview.infrastructure.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.quantumreview.infrastructure.github.InstallationToken;
import dev.quantumreview.infrastructure.github.InstallationTokenCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Installation tokens in Redis under {@code gh:install:<id>:token}, stored as
 * {@code {"token":..., "expiresAt":...}} with a TTL equal to the token's remaining lifetime.
 *
 * <p>Cache trouble never blocks token acquisition: read errors count as a miss and write
 * errors are logged.
 */
@Component
public class RedisInstallationTokenCache implements InstallationTokenCache {

    private static final Logger log = LoggerFactory.getLogger(RedisInstallationTokenCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisInstallationTokenCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<InstallationToken> get(long installationId) {
        try {
            String value = redisTemplate.opsForValue().get(key(installationId));
            if (!StringUtils.hasText(value)) {
                return Optional.empty();
            }
            CachedToken cached = objectMapper.readValue(value, CachedToken.class);
            return Optional.of(new InstallationToken(installationId, cached.token(), Instant.parse(cached.expiresAt())));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to read cached token for installation {}, treating as miss", installationId, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(InstallationToken token, Duration ttl) {
        try {
            String value = objectMapper.writeValueAsString(new CachedToken(token.token(), token.expiresAt().toString()));
            redisTemplate.opsForValue().set(key(token.installationId()), value, ttl);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to cache token for installation {}", token.installationId(), e);
        }
    }

    static String key(long installationId) {
        return "gh:install:" + installationId + ":token";
    }

    record CachedToken(String token, String expiresAt) {}
}
