package com.fenceping.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Enter, exit or dwell transition emitted by the engine. Immutable.
 *
 * @param id        deterministic id derived from device, geofence, type and timestamp
 * @param deviceId  device
 * @param geofenceId geofence
 * @param accountId owning account
 * @param eventType transition type
 * @param latitude  latitude of the triggering sample
 * @param longitude longitude of the triggering sample
 * @param timestamp event time of the triggering sample
 * @param dwellSeconds time spent inside since the enter, set on dwell events only
 */
public record GeofenceEvent(
    String id,
    String deviceId,
    String geofenceId,
    String accountId,
    GeofenceEventType eventType,
    double latitude,
    double longitude,
    Instant timestamp,
    @JsonInclude(JsonInclude.Include.NON_NULL) Long dwellSeconds
) {

    public static GeofenceEvent of(LocationSample sample, GeofenceDefinition geofence, GeofenceEventType type) {
        return of(sample, geofence, type, null);
    }

    public static GeofenceEvent of(LocationSample sample, GeofenceDefinition geofence,
                                   GeofenceEventType type, Long dwellSeconds) {
        return new GeofenceEvent(
            deterministicId(sample.deviceId(), geofence.id(), type, sample.timestamp()),
            sample.deviceId(),
            geofence.id(),
            geofence.accountId(),
            type,
            sample.latitude(),
            sample.longitude(),
            sample.timestamp(),
            dwellSeconds
        );
    }

    /**
     * SHA-256 over {@code deviceId:geofenceId:type:epochMillis}, hex encoded.
     * Redelivery of the same transition always produces the same id.
     */
    public static String deterministicId(String deviceId, String geofenceId,
                                         GeofenceEventType type, Instant timestamp) {
        String material = deviceId + ':' + geofenceId + ':' + type.value() + ':' + timestamp.toEpochMilli();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String toLogString() {
        return String.format("GeofenceEvent[%s device=%s geofence=%s time=%s]",
            eventType.value(), deviceId, geofenceId, timestamp);
    }
}
