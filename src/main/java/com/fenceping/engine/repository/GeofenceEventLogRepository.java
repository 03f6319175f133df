package com.fenceping.engine.repository;

import com.fenceping.engine.entity.GeofenceEventLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Durable event log. Doubles as the outbox for the output stream.
 */
@Repository
public interface GeofenceEventLogRepository extends JpaRepository<GeofenceEventLog, Long> {

    /**
     * Inserts the event unless a row with the same event_id exists.
     *
     * @return 1 when inserted, 0 when the event was already recorded
     */
    @Modifying
    @Transactional
    @Query(value = """
        INSERT INTO geofence_events
            (event_id, device_id, geofence_id, account_id, event_type,
             latitude, longitude, event_time, dwell_seconds, published, created_at)
        VALUES
            (:eventId, :deviceId, :geofenceId, :accountId, :eventType,
             :latitude, :longitude, :eventTime, :dwellSeconds, false, :createdAt)
        ON CONFLICT (event_id) DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(
        @Param("eventId") String eventId,
        @Param("deviceId") String deviceId,
        @Param("geofenceId") String geofenceId,
        @Param("accountId") String accountId,
        @Param("eventType") String eventType,
        @Param("latitude") double latitude,
        @Param("longitude") double longitude,
        @Param("eventTime") Instant eventTime,
        @Param("dwellSeconds") Long dwellSeconds,
        @Param("createdAt") Instant createdAt
    );

    @Modifying
    @Transactional
    @Query("UPDATE GeofenceEventLog e SET e.published = true WHERE e.eventId = :eventId")
    int markPublished(@Param("eventId") String eventId);

    /**
     * Events recorded before the cutoff that never reached the output stream, oldest first.
     */
    @Query("""
        SELECT e FROM GeofenceEventLog e
        WHERE e.published = false
        AND e.createdAt < :cutoff
        ORDER BY e.createdAt ASC
        """)
    List<GeofenceEventLog> findUnpublishedBefore(@Param("cutoff") Instant cutoff, Pageable pageable);

    List<GeofenceEventLog> findByDeviceIdOrderByEventTimeDesc(String deviceId, Pageable pageable);

    long countByPublishedFalse();
}
