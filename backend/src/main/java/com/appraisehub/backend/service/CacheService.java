package com.appraisehub.backend.service;

import jakarta.persistence.Entity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Cache-aside access to Redis. Redis being down never fails a request;
 * the value is computed instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheService {

    private final RedisTemplate<String, Object> redisTemplate;

    public <T> T getOrCompute(String key, Class<T> type, Supplier<T> computeFunction, Duration ttl) {
        Object cached;
        try {
            cached = redisTemplate.opsForValue().get(key);
        } catch (Exception e) {
            log.warn("Redis read failed for key: {}. Computing instead.", key, e);
            return computeFunction.get();
        }

        if (type.isInstance(cached)) {
            log.debug("Cache HIT for key: {}", key);
            return type.cast(cached);
        }

        log.debug("Cache MISS for key: {}", key);
        T computed = computeFunction.get();
        put(key, computed, ttl);
        return computed;
    }

    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        // JPA entities carry lazy proxies and must not be serialized
        if (isJpaEntity(value)) {
            log.warn("Skipping Redis put for JPA entity: {} (key={})", value.getClass().getSimpleName(), key);
            return;
        }
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
            log.debug("Cached value for key: {}", key);
        } catch (Exception e) {
            log.warn("Redis write failed for key: {}", key, e);
        }
    }

    public void invalidate(String key) {
        try {
            redisTemplate.delete(key);
            log.debug("Invalidated cache for key: {}", key);
        } catch (Exception e) {
            log.warn("Redis delete failed for key: {}", key, e);
        }
    }

    public void invalidatePattern(String pattern) {
        try {
            var keys = redisTemplate.keys(pattern);
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.debug("Invalidated {} keys matching pattern: {}", keys.size(), pattern);
            }
        } catch (Exception e) {
            log.warn("Redis delete failed for pattern: {}", pattern, e);
        }
    }

    private boolean isJpaEntity(Object obj) {
        return obj.getClass().isAnnotationPresent(Entity.class);
    }
}
