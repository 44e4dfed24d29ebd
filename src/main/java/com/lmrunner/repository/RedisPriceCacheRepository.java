package com.lmrunner.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmrunner.config.LmRunnerProperties;
import com.lmrunner.cost.ModelPrice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Redis cache in front of the pricing table.
 * Key pattern: price:{provider}:{model}
 */
@Slf4j
@Repository
public class RedisPriceCacheRepository {

    private static final String KEY_PREFIX = "price:";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final LmRunnerProperties properties;

    public RedisPriceCacheRepository(
            RedisTemplate<String, byte[]> redisTemplate,
            ObjectMapper objectMapper,
            LmRunnerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Get a cached price.
     *
     * @return the price if cached; empty on a miss or when Redis is unreachable
     */
    public Optional<ModelPrice> get(String provider, String model) {
        String key = buildKey(provider, model);
        try {
            byte[] json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                log.debug("Price cache miss: {}", key);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, ModelPrice.class));
        } catch (Exception e) {
            log.error("Error reading price cache: key={}", key, e);
            return Optional.empty();
        }
    }

    /**
     * Store a price with the configured TTL.
     */
    public void put(String provider, String model, ModelPrice price) {
        String key = buildKey(provider, model);
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsBytes(price),
                    properties.getPricing().getCacheTtl());
            log.debug("Stored price in cache: key={}", key);
        } catch (Exception e) {
            // a cache write failure must not fail the lookup
            log.error("Error storing price in cache: key={}", key, e);
        }
    }

    private String buildKey(String provider, String model) {
        return KEY_PREFIX + provider + ":" + model;
    }
}
