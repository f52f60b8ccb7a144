package com.flagship.settlement_engine.intake;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for duplicate deliveries.
 *
 * Only events whose processing committed are remembered here, so a hit is
 * always safe to acknowledge. A miss, or Redis being down, falls through to
 * the processed_events table, which stays the source of truth.
 */
@Component
@Slf4j
public class EventDeduplicationCache {

    private static final String REDIS_KEY_PREFIX = "processed-event:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;

    public EventDeduplicationCache(Optional<StringRedisTemplate> redisTemplate,
                                   @Value("${settlement.intake.dedup.redis-enabled:true}") boolean enabled,
                                   @Value("${settlement.intake.dedup.ttl:P7D}") Duration ttl) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled;
        this.ttl = ttl;
    }

    public boolean isKnownDuplicate(String eventId) {
        if (!enabled || redisTemplate.isEmpty()) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.get().hasKey(REDIS_KEY_PREFIX + eventId));
        } catch (Exception e) {
            log.warn("Redis lookup failed for event {}. Falling back to database. Error: {}",
                    eventId, e.getMessage());
            return false;
        }
    }

    public void remember(String eventId) {
        if (!enabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + eventId, "1", ttl);
        } catch (Exception e) {
            log.warn("Failed to cache processed event {} in Redis: {}", eventId, e.getMessage());
        }
    }
}
