package com.fenceping.engine.model;

import java.time.Instant;

/**
 * Containment state of one (device, geofence) pair.
 *
 * Only the partition worker that owns the device mutates it, so instances are
 * replaced wholesale rather than updated in place.
 *
 * @param deviceId              device
 * @param geofenceId            geofence
 * @param status                current status
 * @param enteredAt             event time of the most recent OUTSIDE to INSIDE transition
 * @param lastSampleAt          event time of the most recent sample applied to this pair
 * @param lastEmittedTransition type of the last event emitted for this pair
 */
public record ContainmentState(
    String deviceId,
    String geofenceId,
    ContainmentStatus status,
    Instant enteredAt,
    Instant lastSampleAt,
    GeofenceEventType lastEmittedTransition
) {

    /**
     * Implicit state of a pair that has never been evaluated.
     */
    public static ContainmentState initial(String deviceId, String geofenceId) {
        return new ContainmentState(deviceId, geofenceId, ContainmentStatus.OUTSIDE, null, null, null);
    }

    public boolean isStale(Instant sampleTime) {
        return lastSampleAt != null && !sampleTime.isAfter(lastSampleAt);
    }

    public ContainmentState touched(Instant sampleTime) {
        return new ContainmentState(deviceId, geofenceId, status, enteredAt, sampleTime, lastEmittedTransition);
    }

    public ContainmentState transitioned(ContainmentStatus next, Instant newEnteredAt,
                                         Instant sampleTime, GeofenceEventType emitted) {
        return new ContainmentState(deviceId, geofenceId, next, newEnteredAt, sampleTime, emitted);
    }
}
