package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.exception.GeofenceLoadException;
import com.fenceping.engine.model.GeofenceDefinition;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * In-memory index from account to its active geofences.
 *
 * Architecture:
 * 1. Cache miss: synchronous load-through to the {@link GeofenceSource}
 * 2. Single-flight: concurrent misses for one account share one load
 *    (Caffeine computes each key atomically and blocks other callers of that key)
 * 3. Refresh: scheduled reload of every cached account
 * 4. Invalidation: change notifications drop one account, the next sample reloads it
 *
 * A failed load is never cached. Callers get a RETRYABLE outcome instead of an
 * empty list so transitions are delayed rather than silently missed.
 *
 * Shared by all partition workers; all methods are thread-safe.
 */
@Service
@Slf4j
public class GeofenceIndex {

    private final GeofenceSource geofenceSource;
    private final EngineMetrics metrics;
    private final Cache<String, List<GeofenceDefinition>> cache;

    public GeofenceIndex(GeofenceSource geofenceSource, EngineProperties properties, EngineMetrics metrics) {
        this.geofenceSource = geofenceSource;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
            .expireAfterAccess(properties.getIndex().getIdleExpiry())
            .maximumSize(properties.getIndex().getMaxAccounts())
            .recordStats()
            .build();
    }

    /**
     * Active geofences of an account. OK with an empty list when the account has none,
     * RETRYABLE when the source of truth could not be reached.
     */
    public Outcome<List<GeofenceDefinition>> geofencesFor(String accountId) {
        try {
            return Outcome.ok(cache.get(accountId, this::load));
        } catch (GeofenceLoadException e) {
            metrics.geofenceLoadFailure();
            log.warn("Geofence load failed for account {}", accountId, e);
            return Outcome.retryable(e.getMessage(), e);
        }
    }

    /**
     * Called when the CRUD system reports a change for the account.
     */
    public void invalidate(String accountId) {
        cache.invalidate(accountId);
        log.info("Invalidated geofence index for account {}", accountId);
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.info("Invalidated entire geofence index");
    }

    /**
     * Scheduled refresh of all cached accounts.
     *
     * A failing refresh keeps the previous entry: a stale geofence list is better than
     * forcing every sample of the account into the retry path.
     */
    @Scheduled(fixedDelayString = "${fenceping.engine.index.refresh-interval:PT5M}",
               initialDelayString = "${fenceping.engine.index.refresh-interval:PT5M}")
    public void scheduledRefresh() {
        Set<String> accounts = Set.copyOf(cache.asMap().keySet());
        if (accounts.isEmpty()) {
            return;
        }

        int refreshed = 0;
        for (String accountId : accounts) {
            try {
                // An account invalidated meanwhile stays absent and is reloaded on its next sample
                if (cache.asMap().computeIfPresent(accountId, (key, previous) -> load(key)) != null) {
                    refreshed++;
                }
            } catch (GeofenceLoadException e) {
                metrics.geofenceLoadFailure();
                log.warn("Scheduled refresh failed for account {}, keeping cached geofences", accountId);
            }
        }
        log.info("Geofence index refresh completed: {}/{} accounts refreshed", refreshed, accounts.size());
    }

    public IndexStats stats() {
        var caffeineStats = cache.stats();
        long geofences = cache.asMap().values().stream().mapToLong(List::size).sum();
        return new IndexStats(cache.estimatedSize(), geofences, caffeineStats.hitRate(),
            caffeineStats.loadFailureCount());
    }

    private List<GeofenceDefinition> load(String accountId) {
        List<GeofenceDefinition> definitions = geofenceSource.listActiveGeofences(accountId).stream()
            .filter(GeofenceDefinition::active)
            .toList();
        log.debug("Indexed {} geofences for account {}", definitions.size(), accountId);
        return definitions;
    }

    /**
     * Index statistics for monitoring.
     */
    public record IndexStats(long cachedAccounts, long cachedGeofences, double hitRate, long loadFailures) {
    }
}
