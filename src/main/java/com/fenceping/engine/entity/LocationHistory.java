package com.fenceping.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Point;

import java.time.Instant;

/**
 * Accepted location sample, kept as history. Point is SRID 4326, (longitude, latitude).
 */
@Entity
@Table(
    name = "location_events",
    indexes = @Index(name = "idx_location_event_account_ts", columnList = "account_id, ts"),
    uniqueConstraints = @UniqueConstraint(name = "uq_location_event_device_ts", columnNames = {"device_id", "ts"})
)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, length = 100)
    private String deviceId;

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @Column(name = "loc", columnDefinition = "geography(Point,4326)", nullable = false)
    private Point location;

    @Column(name = "accuracy_m")
    private Double accuracyMeters;

    @Column(name = "altitude_m")
    private Double altitude;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;
}
