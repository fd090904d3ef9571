package com.opsdashboard.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis cache for computed reports, placed in front of the engine.
 *
 * Keys combine the report shape, the domain and the normalized filter, so two
 * requests share an entry only when they would compute the same result. Redis
 * TTLs decide eviction.
 *
 * A failing Redis never fails a report: reads fall back to a miss and writes
 * are skipped, with a circuit breaker around every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportCacheService {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, TypeReference<T> type) {
        String cached = redisTemplate.opsForValue().get(key);

        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }

        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getMessage());
            redisTemplate.delete(key);
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Report for key {} is not serializable, not caching it: {}", key, e.getMessage());
            return;
        }
        redisTemplate.opsForValue().set(key, json, ttlSeconds, TimeUnit.SECONDS);
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateCacheFallback")
    public void invalidate(String key) {
        redisTemplate.delete(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    /**
     * Joins key parts with ':'; null parts are written as "null".
     */
    public String generateCacheKey(String prefix, Object... parts) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object part : parts) {
            key.append(":").append(part != null ? part.toString() : "null");
        }
        return key.toString();
    }

    // Circuit breaker fallbacks

    private <T> Optional<T> getCacheFallback(String key, TypeReference<T> type, Exception e) {
        log.warn("Redis unavailable ({}), computing report without cache", e.getMessage());
        return Optional.empty();
    }

    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache write", e.getMessage());
    }

    private void invalidateCacheFallback(String key, Exception e) {
        log.warn("Redis unavailable ({}), skipping cache invalidation", e.getMessage());
    }
}
