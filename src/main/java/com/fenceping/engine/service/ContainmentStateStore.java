package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.entity.ContainmentStateRecord;
import com.fenceping.engine.model.ContainmentState;
import com.fenceping.engine.model.ContainmentStatus;
import com.fenceping.engine.model.GeofenceEventType;
import com.fenceping.engine.repository.ContainmentStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Write-through store for containment states.
 *
 * Architecture:
 * 1. load: fast cache first, then the containment_states table; a hit in the table
 *    is put back into the cache
 * 2. save: cache is updated immediately, the durable upsert runs on the persistence
 *    executor and is retried with exponential backoff
 * 3. Exhausted retries are logged and counted as a durability risk; the state is pinned
 *    in memory, read ahead of the cache, until a later write of the pair succeeds
 * 4. Pinned states are written again on a fixed schedule
 *
 * The upsert never overwrites a row with a newer last_sample_at, so out-of-order
 * retries of older writes are harmless.
 */
@Service
@Slf4j
public class ContainmentStateStore {

    private final ContainmentStateCache cache;
    private final ContainmentStateRepository repository;
    private final Executor persistenceExecutor;
    private final RetryBackoff backoff;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final Map<ContainmentStateRecord.Key, ContainmentState> unpersisted = new ConcurrentHashMap<>();

    public ContainmentStateStore(ContainmentStateCache cache,
                                 ContainmentStateRepository repository,
                                 @Qualifier("statePersistenceExecutor") Executor persistenceExecutor,
                                 EngineProperties properties,
                                 EngineMetrics metrics,
                                 Clock clock) {
        this.cache = cache;
        this.repository = repository;
        this.persistenceExecutor = persistenceExecutor;
        this.backoff = RetryBackoff.from(properties.getState().getPersistRetry());
        this.metrics = metrics;
        this.clock = clock;
        metrics.trackUnpersistedStates(unpersisted);
    }

    /**
     * Stored state of the pair. OK with an empty Optional when the pair was never
     * evaluated, RETRYABLE when the system of record cannot be read.
     */
    public Outcome<Optional<ContainmentState>> load(String deviceId, String geofenceId) {
        ContainmentState pinned = unpersisted.get(new ContainmentStateRecord.Key(deviceId, geofenceId));
        if (pinned != null) {
            return Outcome.ok(Optional.of(pinned));
        }

        Optional<ContainmentState> cached = cache.get(deviceId, geofenceId);
        if (cached.isPresent()) {
            return Outcome.ok(cached);
        }

        try {
            Optional<ContainmentState> stored = repository
                .findById(new ContainmentStateRecord.Key(deviceId, geofenceId))
                .map(ContainmentStateStore::toState);
            stored.ifPresent(cache::put);
            return Outcome.ok(stored);
        } catch (DataAccessException | TransactionException e) {
            log.warn("State read failed for device {} geofence {}", deviceId, geofenceId, e);
            return Outcome.retryable("Containment state unavailable", e);
        }
    }

    /**
     * Applies the state to the cache and starts its durable write.
     *
     * The returned future never completes exceptionally: OK once the row is written,
     * FATAL once the retry budget is spent.
     */
    public CompletableFuture<Outcome<Void>> save(ContainmentState state) {
        cache.put(state);
        unpersisted.computeIfPresent(key(state), (k, pinned) -> state);
        CompletableFuture<Outcome<Void>> result = new CompletableFuture<>();
        persist(state, 1, result);
        return result;
    }

    public long cachedEntries() {
        return cache.estimatedSize();
    }

    public int unpersistedEntries() {
        return unpersisted.size();
    }

    /**
     * Writes pinned states again. Stops at the first failure, the store is most likely
     * still down.
     */
    @Scheduled(fixedDelayString = "${fenceping.engine.state.unpersisted-retry-interval:PT1M}")
    public void retryUnpersisted() {
        if (unpersisted.isEmpty()) {
            return;
        }

        int written = 0;
        for (Map.Entry<ContainmentStateRecord.Key, ContainmentState> entry : unpersisted.entrySet()) {
            ContainmentState state = entry.getValue();
            try {
                write(state);
            } catch (DataAccessException | TransactionException e) {
                log.warn("Pinned state write still failing, {} state(s) kept in memory: {}",
                    unpersisted.size(), e.getMessage());
                return;
            }
            unpersisted.remove(entry.getKey(), state);
            written++;
        }
        log.info("Persisted {} pinned containment state(s)", written);
    }

    private void persist(ContainmentState state, int attempt, CompletableFuture<Outcome<Void>> result) {
        CompletableFuture.runAsync(() -> write(state), persistenceExecutor).whenComplete((ignored, error) -> {
            if (error == null) {
                unpersisted.remove(key(state), state);
                result.complete(Outcome.ok(null));
                return;
            }

            Throwable cause = error.getCause() != null ? error.getCause() : error;
            if (backoff.exhausted(attempt)) {
                metrics.durabilityRisk();
                unpersisted.merge(key(state), state, ContainmentStateStore::newer);
                log.error("Giving up persisting state of device {} geofence {} after {} attempts, pinned in memory",
                    state.deviceId(), state.geofenceId(), attempt, cause);
                result.complete(Outcome.fatal("State persistence retries exhausted", cause));
                return;
            }

            Duration delay = backoff.delayFor(attempt);
            log.warn("State write attempt {} failed for device {} geofence {}, retrying in {}ms: {}",
                attempt, state.deviceId(), state.geofenceId(), delay.toMillis(), cause.getMessage());
            Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS,
                persistenceExecutor);
            delayed.execute(() -> persist(state, attempt + 1, result));
        });
    }

    private void write(ContainmentState state) {
        int rows = repository.upsert(
            state.deviceId(),
            state.geofenceId(),
            state.status().name(),
            state.enteredAt(),
            state.lastSampleAt(),
            state.lastEmittedTransition() == null ? null : state.lastEmittedTransition().value(),
            clock.instant()
        );
        if (rows == 0) {
            log.debug("Stored state of device {} geofence {} is already newer than {}",
                state.deviceId(), state.geofenceId(), state.lastSampleAt());
        }
    }

    private static ContainmentStateRecord.Key key(ContainmentState state) {
        return new ContainmentStateRecord.Key(state.deviceId(), state.geofenceId());
    }

    private static ContainmentState newer(ContainmentState a, ContainmentState b) {
        return b.lastSampleAt().isAfter(a.lastSampleAt()) ? b : a;
    }

    static ContainmentState toState(ContainmentStateRecord row) {
        return new ContainmentState(
            row.getDeviceId(),
            row.getGeofenceId(),
            ContainmentStatus.valueOf(row.getStatus()),
            row.getEnteredAt(),
            row.getLastSampleAt(),
            row.getLastEmittedTransition() == null ? null : GeofenceEventType.fromValue(row.getLastEmittedTransition())
        );
    }
}
