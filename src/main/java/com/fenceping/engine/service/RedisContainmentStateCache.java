package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.model.ContainmentState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed containment state cache, shared by all engine instances.
 *
 * Key "{prefix}{deviceId}:{geofenceId}", TTL renewed on every read and write.
 *
 * Redis is only a cache here. A Redis failure degrades to a miss on read and a skipped
 * put on write; the system of record stays authoritative.
 */
@Component
@ConditionalOnProperty(name = "fenceping.engine.state.cache-type", havingValue = "redis")
@Slf4j
public class RedisContainmentStateCache implements ContainmentStateCache {

    private final RedisTemplate<String, ContainmentState> redisTemplate;
    private final String keyPrefix;
    private final Duration idleTtl;

    public RedisContainmentStateCache(RedisTemplate<String, ContainmentState> containmentStateRedisTemplate,
                                      EngineProperties properties) {
        this.redisTemplate = containmentStateRedisTemplate;
        this.keyPrefix = properties.getState().getRedisKeyPrefix();
        this.idleTtl = properties.getState().getIdleTtl();
        log.info("Containment state cache: redis, key prefix '{}', idle TTL {}", keyPrefix, idleTtl);
    }

    @Override
    public Optional<ContainmentState> get(String deviceId, String geofenceId) {
        String key = key(deviceId, geofenceId);
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().getAndExpire(key, idleTtl));
        } catch (SerializationException e) {
            log.warn("Unreadable cached state under {}, evicting", key, e);
            evict(deviceId, geofenceId);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Redis read failed for {}, falling back to system of record", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void put(ContainmentState state) {
        String key = key(state.deviceId(), state.geofenceId());
        try {
            redisTemplate.opsForValue().set(key, state, idleTtl);
        } catch (DataAccessException e) {
            log.warn("Redis write failed for {}", key, e);
        }
    }

    @Override
    public void evict(String deviceId, String geofenceId) {
        try {
            redisTemplate.delete(key(deviceId, geofenceId));
        } catch (DataAccessException e) {
            log.warn("Redis evict failed for device {} geofence {}", deviceId, geofenceId, e);
        }
    }

    @Override
    public long estimatedSize() {
        return -1;
    }

    String key(String deviceId, String geofenceId) {
        return keyPrefix + deviceId + ":" + geofenceId;
    }
}
