package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.geometry.GeometryEvaluator;
import com.fenceping.engine.model.ContainmentState;
import com.fenceping.engine.model.ContainmentStatus;
import com.fenceping.engine.model.GeofenceDefinition;
import com.fenceping.engine.model.GeofenceEvent;
import com.fenceping.engine.model.GeofenceEventType;
import com.fenceping.engine.model.GeofenceKind;
import com.fenceping.engine.model.LocationSample;
import com.fenceping.engine.model.Transition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Containment state machine for one (device, geofence) pair.
 *
 * Transitions:
 * - OUTSIDE + inside            -> INSIDE, emits enter (enteredAt = sample time)
 * - INSIDE + inside, dwell due  -> DWELLING, emits dwell carrying the seconds since enteredAt
 * - INSIDE / DWELLING + outside -> OUTSIDE, emits exit
 * - anything else               -> same status, no event
 *
 * Ordering:
 * A sample at or before the pair's lastSampleAt is discarded without touching the state,
 * which makes redelivery and out-of-order arrival harmless. Every other sample advances
 * lastSampleAt, transition or not.
 *
 * Accuracy hysteresis:
 * A sample is noisy when its accuracy exceeds radius * circleRadiusRatio (circles) or
 * maxAccuracyMeters (all other kinds). A noisy sample whose distance to the boundary is
 * within accuracy * boundaryMarginFactor is held: lastSampleAt advances, status does not.
 *
 * Side-effect free; the caller loads, stores and counts.
 */
@Component
@Slf4j
public class StateTracker {

    private final EngineProperties.Accuracy accuracy;

    public StateTracker(EngineProperties properties) {
        this.accuracy = properties.getAccuracy();
    }

    /**
     * @param current stored state, or {@code null} if the pair was never evaluated
     * @throws com.fenceping.engine.exception.InvalidCoordinateException if the sample coordinates are out of range
     */
    public Transition apply(LocationSample sample, GeofenceDefinition geofence, ContainmentState current) {
        ContainmentState state = current != null
            ? current
            : ContainmentState.initial(sample.deviceId(), geofence.id());

        if (state.isStale(sample.timestamp())) {
            log.debug("Stale sample for geofence {}: {} <= {}",
                geofence.id(), sample.timestamp(), state.lastSampleAt());
            return Transition.discarded();
        }

        boolean inside = GeometryEvaluator.contains(geofence.geometry(), sample.point());

        if (isAmbiguous(sample, geofence)) {
            log.debug("Held near-boundary sample {} for {}", sample.toLogString(), geofence.toLogString());
            return Transition.held(state.touched(sample.timestamp()));
        }

        Instant now = sample.timestamp();
        return switch (state.status()) {
            case OUTSIDE -> inside
                ? emit(sample, geofence, state.transitioned(ContainmentStatus.INSIDE, now, now, GeofenceEventType.ENTER))
                : Transition.unchanged(state.touched(now));
            case INSIDE -> {
                if (!inside) {
                    yield exit(sample, geofence, state);
                }
                if (dwellDue(geofence, state, now)) {
                    ContainmentState dwelling = state.transitioned(
                        ContainmentStatus.DWELLING, state.enteredAt(), now, GeofenceEventType.DWELL);
                    long dwellSeconds = Duration.between(state.enteredAt(), now).getSeconds();
                    yield Transition.emitted(dwelling,
                        GeofenceEvent.of(sample, geofence, GeofenceEventType.DWELL, dwellSeconds));
                }
                yield Transition.unchanged(state.touched(now));
            }
            case DWELLING -> inside
                ? Transition.unchanged(state.touched(now))
                : exit(sample, geofence, state);
        };
    }

    /**
     * Whether the sample is too imprecise to decide containment for this geofence.
     */
    boolean isAmbiguous(LocationSample sample, GeofenceDefinition geofence) {
        if (!sample.hasAccuracy()) {
            return false;
        }
        double acc = sample.accuracyMeters();
        double threshold = geofence.kind() == GeofenceKind.CIRCLE
            ? geofence.geometry().radiusMeters() * accuracy.getCircleRadiusRatio()
            : accuracy.getMaxAccuracyMeters();
        if (acc <= threshold) {
            return false;
        }
        double margin = acc * accuracy.getBoundaryMarginFactor();
        return GeometryEvaluator.distanceToBoundaryMeters(geofence.geometry(), sample.point()) <= margin;
    }

    private static boolean dwellDue(GeofenceDefinition geofence, ContainmentState state, Instant now) {
        if (!geofence.dwellEnabled() || state.enteredAt() == null) {
            return false;
        }
        Duration elapsed = Duration.between(state.enteredAt(), now);
        return elapsed.getSeconds() >= geofence.dwellThresholdSeconds();
    }

    private static Transition exit(LocationSample sample, GeofenceDefinition geofence, ContainmentState state) {
        return emit(sample, geofence, state.transitioned(
            ContainmentStatus.OUTSIDE, state.enteredAt(), sample.timestamp(), GeofenceEventType.EXIT));
    }

    private static Transition emit(LocationSample sample, GeofenceDefinition geofence, ContainmentState next) {
        GeofenceEvent event = GeofenceEvent.of(sample, geofence, next.lastEmittedTransition());
        return Transition.emitted(next, event);
    }
}
