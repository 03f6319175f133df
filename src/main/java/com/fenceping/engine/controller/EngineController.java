package com.fenceping.engine.controller;

import com.fenceping.engine.dto.EvaluateRequest;
import com.fenceping.engine.dto.EvaluationResult;
import com.fenceping.engine.entity.GeofenceEventLog;
import com.fenceping.engine.geometry.GeometryEvaluator;
import com.fenceping.engine.model.GeofenceDefinition;
import com.fenceping.engine.repository.GeofenceEventLogRepository;
import com.fenceping.engine.service.ContainmentStateStore;
import com.fenceping.engine.service.GeofenceIndex;
import com.fenceping.engine.service.LocationSampleProcessor;
import com.fenceping.engine.service.Outcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints of the detection engine.
 *
 * The engine has no end-user surface; these endpoints exist for operators:
 * 1. Health and index statistics
 * 2. Inspect or invalidate the cached geofences of an account
 * 3. Look up the containment state of a (device, geofence) pair
 * 4. Recent events of a device from the durable event log
 * 5. Dry-run evaluation of a coordinate, without storing or publishing anything
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Geofence Engine", description = "Operational API of the geofence event detection engine")
public class EngineController {

    private static final int MAX_EVENT_LIMIT = 500;

    private final GeofenceIndex geofenceIndex;
    private final ContainmentStateStore stateStore;
    private final LocationSampleProcessor sampleProcessor;
    private final GeofenceEventLogRepository eventLogRepository;
    private final Clock clock;

    @Operation(
            summary = "Dry-run a coordinate against an account's geofences",
            description = "Reports containment, boundary distance and the transition the sample would cause. " +
                    "Nothing is stored or published."
    )
    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@Valid @RequestBody EvaluateRequest request) {
        var sample = request.toSample(clock.instant());
        GeometryEvaluator.validate(sample.point());

        Outcome<List<EvaluationResult>> outcome = sampleProcessor.evaluate(sample);
        if (!outcome.isOk()) {
            return failure(outcome);
        }

        return ResponseEntity.ok(Map.of(
            "deviceId", sample.deviceId(),
            "timestamp", sample.timestamp(),
            "geofences", outcome.value()
        ));
    }

    @Operation(summary = "Geofence index statistics")
    @GetMapping("/index/stats")
    public ResponseEntity<GeofenceIndex.IndexStats> indexStats() {
        return ResponseEntity.ok(geofenceIndex.stats());
    }

    /**
     * Active geofences of the account as the engine currently sees them.
     * Loads the account into the index if it was not cached.
     */
    @Operation(summary = "Indexed geofences of an account")
    @GetMapping("/index/{accountId}")
    public ResponseEntity<?> indexedGeofences(@PathVariable String accountId) {
        Outcome<List<GeofenceDefinition>> outcome = geofenceIndex.geofencesFor(accountId);
        if (!outcome.isOk()) {
            return failure(outcome);
        }

        List<Map<String, Object>> geofences = outcome.value().stream()
            .map(EngineController::summary)
            .toList();
        return ResponseEntity.ok(Map.of(
            "accountId", accountId,
            "count", geofences.size(),
            "geofences", geofences
        ));
    }

    @Operation(summary = "Drop an account from the geofence index", description = "The next sample reloads it.")
    @DeleteMapping("/index/{accountId}")
    public ResponseEntity<?> invalidate(@PathVariable String accountId) {
        geofenceIndex.invalidate(accountId);
        return ResponseEntity.ok(Map.of(
            "status", "SUCCESS",
            "message", "Index entry invalidated",
            "accountId", accountId
        ));
    }

    @Operation(summary = "Containment state of a device for one geofence")
    @GetMapping("/state/{deviceId}/{geofenceId}")
    public ResponseEntity<?> state(@PathVariable String deviceId, @PathVariable String geofenceId) {
        var outcome = stateStore.load(deviceId, geofenceId);
        if (!outcome.isOk()) {
            return failure(outcome);
        }
        return outcome.value()
            .<ResponseEntity<?>>map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "status", "NOT_FOUND",
                "message", "Pair was never evaluated, implicitly OUTSIDE"
            )));
    }

    @Operation(summary = "Recent geofence events of a device, newest first")
    @GetMapping("/events/{deviceId}")
    public ResponseEntity<List<GeofenceEventLog>> recentEvents(
        @PathVariable String deviceId,
        @Parameter(description = "Maximum number of events", example = "50")
        @RequestParam(defaultValue = "50") int limit
    ) {
        int size = Math.max(1, Math.min(limit, MAX_EVENT_LIMIT));
        return ResponseEntity.ok(
            eventLogRepository.findByDeviceIdOrderByEventTimeDesc(deviceId, PageRequest.of(0, size)));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<?> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("service", "Geofence Event Detection Engine");
        body.put("timestamp", clock.instant());
        body.put("indexedAccounts", geofenceIndex.stats().cachedAccounts());
        body.put("cachedStates", stateStore.cachedEntries());
        body.put("unpersistedStates", stateStore.unpersistedEntries());
        body.put("unpublishedEvents", eventLogRepository.countByPublishedFalse());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> summary(GeofenceDefinition geofence) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", geofence.id());
        summary.put("name", geofence.name());
        summary.put("kind", geofence.kind().value());
        summary.put("rings", geofence.geometry().ringCount());
        if (geofence.geometry().isRadial()) {
            summary.put("center", geofence.geometry().center().toString());
            summary.put("radiusMeters", geofence.geometry().radiusMeters());
        }
        summary.put("dwellThresholdSeconds", geofence.dwellThresholdSeconds());
        return summary;
    }

    private static ResponseEntity<?> failure(Outcome<?> outcome) {
        HttpStatus status = outcome.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(Map.of(
            "status", outcome.status().name(),
            "message", outcome.reason()
        ));
    }
}
