package com.fenceping.engine.repository;

import com.fenceping.engine.entity.LocationHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface LocationHistoryRepository extends JpaRepository<LocationHistory, Long> {

    /**
     * Records the sample unless the device already has a row at the same event time.
     *
     * @return 1 when inserted, 0 for a redelivered sample
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO location_events
            (device_id, account_id, ts, loc, accuracy_m, altitude_m, received_at)
        VALUES
            (:deviceId, :accountId, :ts,
             CAST(ST_SetSRID(ST_MakePoint(:longitude, :latitude), 4326) AS geography),
             :accuracyMeters, :altitude, :receivedAt)
        ON CONFLICT (device_id, ts) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(
        @Param("deviceId") String deviceId,
        @Param("accountId") String accountId,
        @Param("ts") Instant timestamp,
        @Param("latitude") double latitude,
        @Param("longitude") double longitude,
        @Param("accuracyMeters") Double accuracyMeters,
        @Param("altitude") Double altitude,
        @Param("receivedAt") Instant receivedAt
    );
}
