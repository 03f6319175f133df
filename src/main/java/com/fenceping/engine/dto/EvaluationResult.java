package com.fenceping.engine.dto;

import com.fenceping.engine.model.ContainmentStatus;
import com.fenceping.engine.model.GeofenceEventType;

/**
 * Dry-run evaluation of one sample against one geofence.
 *
 * Produced by the evaluate endpoint; nothing is stored or published.
 *
 * @param geofenceId          evaluated geofence
 * @param geofenceName        display name
 * @param kind                circle, polygon, multipolygon or point
 * @param inside              raw containment result
 * @param distanceToBoundary  approximate distance to the nearest boundary in meters
 * @param currentStatus       stored status of the pair, OUTSIDE if never evaluated
 * @param nextStatus          status the sample would lead to; {@code null} when stale
 * @param stale               sample is not newer than the pair's lastSampleAt
 * @param held                sample would be held by the accuracy hysteresis
 * @param wouldEmit           event the sample would emit, if any
 */
public record EvaluationResult(
    String geofenceId,
    String geofenceName,
    String kind,
    boolean inside,
    double distanceToBoundary,
    ContainmentStatus currentStatus,
    ContainmentStatus nextStatus,
    boolean stale,
    boolean held,
    GeofenceEventType wouldEmit
) {
}
