package com.fenceping.engine.repository;

import com.fenceping.engine.entity.ContainmentStateRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * System of record for containment states, one row per (device, geofence).
 */
@Repository
public interface ContainmentStateRepository
    extends JpaRepository<ContainmentStateRecord, ContainmentStateRecord.Key> {

    /**
     * Idempotent upsert keyed by (device_id, geofence_id).
     *
     * The WHERE clause on the update branch keeps the row with the newest
     * last_sample_at, so a delayed retry of an older write cannot roll state back.
     *
     * @return rows written (0 when the stored row is already newer)
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO containment_states
            (device_id, geofence_id, status, entered_at, last_sample_at, last_emitted_transition, updated_at)
        VALUES
            (:deviceId, :geofenceId, :status, :enteredAt, :lastSampleAt, :lastEmitted, :updatedAt)
        ON CONFLICT (device_id, geofence_id) DO UPDATE SET
            status = EXCLUDED.status,
            entered_at = EXCLUDED.entered_at,
            last_sample_at = EXCLUDED.last_sample_at,
            last_emitted_transition = EXCLUDED.last_emitted_transition,
            updated_at = EXCLUDED.updated_at
        WHERE containment_states.last_sample_at < EXCLUDED.last_sample_at
        """, nativeQuery = true)
    int upsert(
        @Param("deviceId") String deviceId,
        @Param("geofenceId") String geofenceId,
        @Param("status") String status,
        @Param("enteredAt") Instant enteredAt,
        @Param("lastSampleAt") Instant lastSampleAt,
        @Param("lastEmitted") String lastEmittedTransition,
        @Param("updatedAt") Instant updatedAt
    );
}
