package com.fenceping.engine.service;

import com.fenceping.engine.model.ContainmentState;

import java.util.Optional;

/**
 * Fast cache in front of the containment state system of record.
 *
 * Entries expire after an idle TTL. The cache is never the only copy of a state: the
 * worker waits for the durable write before acknowledging the sample, and a state whose
 * write exhausted its retries is pinned by {@link ContainmentStateStore}.
 */
public interface ContainmentStateCache {

    Optional<ContainmentState> get(String deviceId, String geofenceId);

    void put(ContainmentState state);

    void evict(String deviceId, String geofenceId);

    /**
     * Approximate entry count, or -1 when the backend cannot tell cheaply.
     */
    long estimatedSize();
}
