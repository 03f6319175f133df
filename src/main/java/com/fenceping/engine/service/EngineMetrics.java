package com.fenceping.engine.service;

import com.fenceping.engine.model.GeofenceEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Operational counters of the engine. Its failure surface is metrics, logs and the
 * dead-letter topic, so every dropped, delayed or at-risk item is counted here.
 */
@Component
public class EngineMetrics {

    private final Counter samplesProcessed;
    private final Counter samplesStale;
    private final Counter samplesHeld;
    private final Counter samplesMalformed;
    private final Counter samplesRetried;
    private final Counter samplesDeadLettered;
    private final Counter duplicateEvents;
    private final Counter publishFailures;
    private final Counter geofenceLoadFailures;
    private final Counter invalidGeometries;
    private final Counter durabilityRisk;
    private final Counter outboxRepublished;
    private final Counter historyWriteFailures;
    private final Map<GeofenceEventType, Counter> eventsEmitted = new EnumMap<>(GeofenceEventType.class);
    private final Timer sampleTimer;
    private final MeterRegistry meterRegistry;

    public EngineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.samplesProcessed = counter(meterRegistry, "fenceping.samples.processed",
            "Location samples fully processed and acknowledged");
        this.samplesStale = counter(meterRegistry, "fenceping.samples.stale",
            "Per-geofence evaluations discarded because the sample was not newer than lastSampleAt");
        this.samplesHeld = counter(meterRegistry, "fenceping.samples.held",
            "Per-geofence evaluations held by the accuracy hysteresis");
        this.samplesMalformed = counter(meterRegistry, "fenceping.samples.malformed",
            "Samples dropped as malformed or with invalid coordinates");
        this.samplesRetried = counter(meterRegistry, "fenceping.samples.retried",
            "Redeliveries requested after a retryable failure");
        this.samplesDeadLettered = counter(meterRegistry, "fenceping.samples.dead_lettered",
            "Samples routed to the dead-letter topic");
        this.duplicateEvents = counter(meterRegistry, "fenceping.events.duplicate",
            "Publishes skipped because the event id was already recorded");
        this.publishFailures = counter(meterRegistry, "fenceping.events.publish_failures",
            "Failed durable writes or stream sends of geofence events");
        this.geofenceLoadFailures = counter(meterRegistry, "fenceping.index.load_failures",
            "Failed loads from the geofence source of truth");
        this.invalidGeometries = counter(meterRegistry, "fenceping.index.invalid_geometries",
            "Stored geofences skipped because their geometry is malformed");
        this.durabilityRisk = counter(meterRegistry, "fenceping.state.durability_risk",
            "Containment state writes that exhausted their persistence retries");
        this.outboxRepublished = counter(meterRegistry, "fenceping.outbox.republished",
            "Events republished by the outbox relay");
        this.historyWriteFailures = counter(meterRegistry, "fenceping.history.write_failures",
            "Failed writes of accepted samples to the location history");

        for (GeofenceEventType type : GeofenceEventType.values()) {
            eventsEmitted.put(type, Counter.builder("fenceping.events.emitted")
                .description("Geofence transitions emitted")
                .tag("type", type.value())
                .register(meterRegistry));
        }

        this.sampleTimer = Timer.builder("fenceping.samples.duration")
            .description("Processing time of one location sample across all candidate geofences")
            .register(meterRegistry);
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    public void sampleProcessed() {
        samplesProcessed.increment();
    }

    public void sampleStale() {
        samplesStale.increment();
    }

    public void sampleHeld() {
        samplesHeld.increment();
    }

    public void sampleMalformed() {
        samplesMalformed.increment();
    }

    public void sampleRetried() {
        samplesRetried.increment();
    }

    public void sampleDeadLettered() {
        samplesDeadLettered.increment();
    }

    public void eventEmitted(GeofenceEventType type) {
        eventsEmitted.get(type).increment();
    }

    public void duplicateEvent() {
        duplicateEvents.increment();
    }

    public void publishFailure() {
        publishFailures.increment();
    }

    public void geofenceLoadFailure() {
        geofenceLoadFailures.increment();
    }

    public void invalidGeometry() {
        invalidGeometries.increment();
    }

    public void durabilityRisk() {
        durabilityRisk.increment();
    }

    public void outboxRepublished() {
        outboxRepublished.increment();
    }

    public void historyWriteFailure() {
        historyWriteFailures.increment();
    }

    /**
     * Gauge over the containment states whose durable write is still outstanding.
     */
    public void trackUnpersistedStates(Map<?, ?> unpersisted) {
        Gauge.builder("fenceping.state.unpersisted", unpersisted, Map::size)
            .description("Containment states held in memory only because their durable write failed")
            .register(meterRegistry);
    }

    public Timer sampleTimer() {
        return sampleTimer;
    }
}
