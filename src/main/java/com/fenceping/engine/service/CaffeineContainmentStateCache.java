package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.model.ContainmentState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * In-process containment state cache (default).
 *
 * Concurrent reads from all workers are safe; a given key is only ever written by the
 * worker owning the device's partition.
 */
@Component
@ConditionalOnProperty(name = "fenceping.engine.state.cache-type", havingValue = "caffeine", matchIfMissing = true)
@Slf4j
public class CaffeineContainmentStateCache implements ContainmentStateCache {

    private final Cache<PairKey, ContainmentState> cache;

    public CaffeineContainmentStateCache(EngineProperties properties) {
        this.cache = Caffeine.newBuilder()
            .expireAfterAccess(properties.getState().getIdleTtl())
            .maximumSize(properties.getState().getMaxEntries())
            .build();
        log.info("Containment state cache: caffeine, idle TTL {}", properties.getState().getIdleTtl());
    }

    @Override
    public Optional<ContainmentState> get(String deviceId, String geofenceId) {
        return Optional.ofNullable(cache.getIfPresent(new PairKey(deviceId, geofenceId)));
    }

    @Override
    public void put(ContainmentState state) {
        cache.put(new PairKey(state.deviceId(), state.geofenceId()), state);
    }

    @Override
    public void evict(String deviceId, String geofenceId) {
        cache.invalidate(new PairKey(deviceId, geofenceId));
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    private record PairKey(String deviceId, String geofenceId) {
    }
}
