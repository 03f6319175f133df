package com.fenceping.engine.service;

import com.fenceping.engine.config.EngineProperties;
import com.fenceping.engine.dto.EvaluationResult;
import com.fenceping.engine.exception.InvalidCoordinateException;
import com.fenceping.engine.geometry.GeometryEvaluator;
import com.fenceping.engine.model.ContainmentState;
import com.fenceping.engine.model.GeofenceDefinition;
import com.fenceping.engine.model.GeofenceEvent;
import com.fenceping.engine.model.LocationSample;
import com.fenceping.engine.model.Transition;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs one location sample through the engine.
 *
 * Per sample:
 * 1. Validate coordinates and reject timestamps too far in the future
 * 2. Resolve the owning account if the sample carries none
 * 3. Record the sample in the location history
 * 4. Fetch the account's active geofences from the index
 * 5. For every geofence, sequentially: load state, apply the tracker, record the
 *    event (if any), then save the new state
 * 6. Wait for the durable state writes before reporting OK
 *
 * The event is recorded before its state is saved. If the event write fails, the state
 * is left as it was, so the redelivered sample recomputes the same transition and the
 * deterministic event id absorbs any duplicate.
 *
 * Called by exactly one partition worker per device at a time; no locking per device.
 */
@Service
@Slf4j
public class LocationSampleProcessor {

    private final DeviceDirectory deviceDirectory;
    private final GeofenceIndex geofenceIndex;
    private final ContainmentStateStore stateStore;
    private final StateTracker stateTracker;
    private final EventPublisher eventPublisher;
    private final LocationHistoryRecorder historyRecorder;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final Duration futureTolerance;

    public LocationSampleProcessor(DeviceDirectory deviceDirectory,
                                   GeofenceIndex geofenceIndex,
                                   ContainmentStateStore stateStore,
                                   StateTracker stateTracker,
                                   EventPublisher eventPublisher,
                                   LocationHistoryRecorder historyRecorder,
                                   EngineMetrics metrics,
                                   Clock clock,
                                   EngineProperties properties) {
        this.deviceDirectory = deviceDirectory;
        this.geofenceIndex = geofenceIndex;
        this.stateStore = stateStore;
        this.stateTracker = stateTracker;
        this.eventPublisher = eventPublisher;
        this.historyRecorder = historyRecorder;
        this.metrics = metrics;
        this.clock = clock;
        this.futureTolerance = properties.getSample().getFutureTolerance();
    }

    /**
     * @return OK with the events of this sample (including ones already recorded by an
     *         earlier delivery), RETRYABLE or FATAL otherwise
     */
    public Outcome<List<GeofenceEvent>> process(LocationSample sample) {
        Timer.Sample timing = Timer.start();
        try {
            return doProcess(sample);
        } finally {
            timing.stop(metrics.sampleTimer());
        }
    }

    private Outcome<List<GeofenceEvent>> doProcess(LocationSample sample) {
        Outcome<LocationSample> checked = check(sample);
        if (!checked.isOk()) {
            return checked.failure();
        }
        LocationSample resolved = checked.value();

        Outcome<Void> recorded = historyRecorder.record(resolved);
        if (!recorded.isOk()) {
            return recorded.failure();
        }

        Outcome<List<GeofenceDefinition>> geofences = geofenceIndex.geofencesFor(resolved.accountId());
        if (!geofences.isOk()) {
            return geofences.failure();
        }

        List<GeofenceEvent> events = new ArrayList<>();
        List<CompletableFuture<Outcome<Void>>> writes = new ArrayList<>();

        for (GeofenceDefinition geofence : geofences.value()) {
            Outcome<Optional<ContainmentState>> loaded = stateStore.load(resolved.deviceId(), geofence.id());
            if (!loaded.isOk()) {
                return loaded.failure();
            }

            Transition transition = stateTracker.apply(resolved, geofence, loaded.value().orElse(null));
            if (transition.stale()) {
                metrics.sampleStale();
                continue;
            }
            if (transition.ambiguous()) {
                metrics.sampleHeld();
            }

            Optional<GeofenceEvent> event = transition.emittedEvent();
            if (event.isPresent()) {
                Outcome<Void> published = eventPublisher.publish(event.get());
                if (!published.isOk()) {
                    return published.failure();
                }
                log.info("Geofence {} for device {}: {}", event.get().eventType().value(),
                    resolved.deviceId(), geofence.toLogString());
                events.add(event.get());
            }

            writes.add(stateStore.save(transition.state()));
        }

        // Durability failures past the retry budget are counted by the store; the sample still completes
        CompletableFuture.allOf(writes.toArray(new CompletableFuture[0])).join();

        metrics.sampleProcessed();
        return Outcome.ok(events);
    }

    /**
     * Side-effect free evaluation against the stored state, for diagnostics.
     */
    public Outcome<List<EvaluationResult>> evaluate(LocationSample sample) {
        Outcome<LocationSample> checked = check(sample);
        if (!checked.isOk()) {
            return checked.failure();
        }
        LocationSample resolved = checked.value();

        Outcome<List<GeofenceDefinition>> geofences = geofenceIndex.geofencesFor(resolved.accountId());
        if (!geofences.isOk()) {
            return geofences.failure();
        }

        List<EvaluationResult> results = new ArrayList<>();
        for (GeofenceDefinition geofence : geofences.value()) {
            Outcome<Optional<ContainmentState>> loaded = stateStore.load(resolved.deviceId(), geofence.id());
            if (!loaded.isOk()) {
                return loaded.failure();
            }
            ContainmentState current = loaded.value()
                .orElse(ContainmentState.initial(resolved.deviceId(), geofence.id()));
            Transition transition = stateTracker.apply(resolved, geofence, current);

            results.add(new EvaluationResult(
                geofence.id(),
                geofence.name(),
                geofence.kind().value(),
                GeometryEvaluator.contains(geofence.geometry(), resolved.point()),
                GeometryEvaluator.distanceToBoundaryMeters(geofence.geometry(), resolved.point()),
                current.status(),
                transition.stale() ? null : transition.state().status(),
                transition.stale(),
                transition.ambiguous(),
                transition.emittedEvent().map(GeofenceEvent::eventType).orElse(null)
            ));
        }
        return Outcome.ok(results);
    }

    /**
     * Validation and account resolution shared by processing and evaluation.
     */
    private Outcome<LocationSample> check(LocationSample sample) {
        try {
            GeometryEvaluator.validate(sample.point());
        } catch (InvalidCoordinateException e) {
            metrics.sampleMalformed();
            log.warn("Dropping sample with invalid coordinates: {}", sample.toLogString());
            return Outcome.fatal(e.getMessage(), e);
        }

        if (sample.timestamp().isAfter(clock.instant().plus(futureTolerance))) {
            metrics.sampleMalformed();
            log.warn("Dropping sample from the future: {}", sample.toLogString());
            return Outcome.fatal("Sample timestamp " + sample.timestamp() + " is in the future", null);
        }

        if (sample.accountId() != null) {
            return Outcome.ok(sample);
        }

        Outcome<Optional<String>> account = deviceDirectory.accountOf(sample.deviceId());
        if (!account.isOk()) {
            return account.failure();
        }
        if (account.value().isEmpty()) {
            metrics.sampleMalformed();
            log.warn("Dropping sample of unknown device {}", sample.deviceId());
            return Outcome.fatal("Unknown device " + sample.deviceId(), null);
        }
        return Outcome.ok(sample.withAccountId(account.value().get()));
    }
}
