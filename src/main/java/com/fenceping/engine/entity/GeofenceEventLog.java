package com.fenceping.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable audit row for an emitted geofence event.
 *
 * The deterministic {@code event_id} carries the unique constraint that makes repeated
 * publishes of the same transition a no-op. {@code published} flips to true once the
 * event reached the output stream; the outbox relay republishes rows left false.
 */
@Entity
@Table(
    name = "geofence_events",
    indexes = {
        @Index(name = "idx_gf_event_device_time", columnList = "device_id, event_time"),
        @Index(name = "idx_gf_event_unpublished", columnList = "published, created_at")
    },
    uniqueConstraints = @UniqueConstraint(name = "uq_gf_event_id", columnNames = "event_id")
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, length = 64)
    private String eventId;

    @Column(name = "device_id", nullable = false, length = 100)
    private String deviceId;

    @Column(name = "geofence_id", nullable = false, length = 100)
    private String geofenceId;

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Column(name = "event_type", nullable = false, length = 20)
    private String eventType;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Column(name = "event_time", nullable = false)
    private Instant eventTime;

    /**
     * Set on dwell events only.
     */
    @Column(name = "dwell_seconds")
    private Long dwellSeconds;

    @Column(nullable = false)
    private boolean published;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
