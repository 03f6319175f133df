package com.fenceping.engine.model;

import java.time.Instant;

/**
 * One device location report, immutable.
 *
 * @param deviceId       reporting device, also the stream partition key
 * @param accountId      owning account; {@code null} until resolved from the device registry
 * @param latitude       latitude in decimal degrees
 * @param longitude      longitude in decimal degrees
 * @param accuracyMeters optional horizontal accuracy radius
 * @param altitude       optional altitude in meters
 * @param timestamp      event time, not ingestion time
 */
public record LocationSample(
    String deviceId,
    String accountId,
    double latitude,
    double longitude,
    Double accuracyMeters,
    Double altitude,
    Instant timestamp
) {

    public GeoPoint point() {
        return new GeoPoint(latitude, longitude);
    }

    public boolean hasAccuracy() {
        return accuracyMeters != null;
    }

    public LocationSample withAccountId(String resolvedAccountId) {
        return new LocationSample(deviceId, resolvedAccountId, latitude, longitude,
            accuracyMeters, altitude, timestamp);
    }

    public String toLogString() {
        return String.format("Sample[device=%s, lat=%.6f, lon=%.6f, acc=%s, time=%s]",
            deviceId, latitude, longitude, accuracyMeters, timestamp);
    }
}
