package com.fenceping.engine.model;

import java.util.Optional;

/**
 * Result of applying one sample to one (device, geofence) pair.
 *
 * @param state    state to store; {@code null} when the sample was stale
 * @param event    event to publish, if the sample caused a transition
 * @param stale    the sample was at or before {@code lastSampleAt} and was discarded
 * @param ambiguous the sample fell inside the accuracy margin of the boundary and was held
 */
public record Transition(ContainmentState state, GeofenceEvent event, boolean stale, boolean ambiguous) {

    public static Transition discarded() {
        return new Transition(null, null, true, false);
    }

    public static Transition unchanged(ContainmentState state) {
        return new Transition(state, null, false, false);
    }

    public static Transition held(ContainmentState state) {
        return new Transition(state, null, false, true);
    }

    public static Transition emitted(ContainmentState state, GeofenceEvent event) {
        return new Transition(state, event, false, false);
    }

    public Optional<GeofenceEvent> emittedEvent() {
        return Optional.ofNullable(event);
    }
}
