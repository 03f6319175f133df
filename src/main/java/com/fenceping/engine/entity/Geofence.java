package com.fenceping.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

import java.time.Instant;
import java.util.UUID;

/**
 * Geofence row owned by the CRUD system. The engine only reads it.
 *
 * Geometry column conventions:
 * - circle / point: a Point center, radius in {@code radius_m}
 * - polygon: a Polygon, first ring is the shell, further rings are holes
 * - multipolygon: a MultiPolygon
 * SRID 4326, so JTS coordinates are (longitude, latitude).
 */
@Entity
@Table(name = "geofences", indexes = {
    @Index(name = "idx_geofence_account_active", columnList = "account_id, is_active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Geofence {

    @Id
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(nullable = false, length = 255)
    private String name;

    /**
     * circle, polygon, multipolygon or point
     */
    @Column(name = "geofence_type", nullable = false, length = 50)
    private String geofenceType;

    @Column(name = "geometry", columnDefinition = "geometry(Geometry,4326)", nullable = false)
    private Geometry geometry;

    @Column(name = "radius_m")
    private Double radiusMeters;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    /**
     * Null disables dwell detection for this geofence.
     */
    @Column(name = "dwell_threshold_seconds")
    private Long dwellThresholdSeconds;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
