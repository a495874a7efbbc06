package com.taodividends.backend.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taodividends.backend.config.TaoProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis implementation using StringRedisTemplate. Entries are JSON documents with a Redis TTL;
 * an unreadable document or an unreachable Redis reads as a miss.
 */
@Slf4j
@Component
public class RedisDividendCacheStore implements DividendCacheStore {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String prefix;

    public RedisDividendCacheStore(StringRedisTemplate redis, ObjectMapper objectMapper, TaoProperties taoProperties) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        String configured = taoProperties.getCache().getKeyPrefix();
        this.prefix = configured == null ? "" : configured;
    }

    private String redisKey(String fingerprint) {
        return prefix + fingerprint;
    }

    @Override
    public Optional<CachedDividend> get(String fingerprint) {
        String raw;
        try {
            raw = redis.opsForValue().get(redisKey(fingerprint));
        } catch (DataAccessException e) {
            log.warn("Cache read failed for {}: {}", fingerprint, e.getMessage());
            return Optional.empty();
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            Payload payload = objectMapper.readValue(raw, Payload.class);
            return Optional.of(new CachedDividend(
                    new BigInteger(payload.value()),
                    Instant.ofEpochMilli(payload.storedAt()),
                    Instant.ofEpochMilli(payload.expiresAt())));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Discarding unreadable cache entry {}: {}", fingerprint, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String fingerprint, CachedDividend entry, Duration ttl) {
        Payload payload = new Payload(entry.value().toString(),
                entry.storedAt().toEpochMilli(),
                entry.expiresAt().toEpochMilli());
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise cache entry " + fingerprint, e);
        }
        redis.opsForValue().set(redisKey(fingerprint), json, ttl.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void evict(String fingerprint) {
        redis.delete(redisKey(fingerprint));
    }

    // Dividends exceed the long range, so the value travels as a decimal string.
    record Payload(String value, long storedAt, long expiresAt) {
    }
}
