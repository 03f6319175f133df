package com.fenceping.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * System-of-record row for the containment state of one (device, geofence) pair.
 *
 * Writes go through {@code ContainmentStateRepository.upsert}, which never replaces a row
 * with one carrying an older {@code last_sample_at}.
 */
@Entity
@Table(name = "containment_states")
@IdClass(ContainmentStateRecord.Key.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContainmentStateRecord {

    @Id
    @Column(name = "device_id", nullable = false, length = 100)
    private String deviceId;

    @Id
    @Column(name = "geofence_id", nullable = false, length = 100)
    private String geofenceId;

    /**
     * OUTSIDE, INSIDE or DWELLING
     */
    @Column(nullable = false, length = 20)
    private String status;

    @Column(name = "entered_at")
    private Instant enteredAt;

    @Column(name = "last_sample_at", nullable = false)
    private Instant lastSampleAt;

    /**
     * enter, exit or dwell
     */
    @Column(name = "last_emitted_transition", length = 20)
    private String lastEmittedTransition;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {
        private String deviceId;
        private String geofenceId;
    }
}
