package com.fenceping.engine.dto;

import com.fenceping.engine.model.LocationSample;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * Body of the dry-run evaluate endpoint.
 *
 * @param deviceId       device whose stored states are used as the starting point
 * @param accountId      account whose geofences are evaluated; resolved from the device if absent
 * @param latitude       latitude in decimal degrees
 * @param longitude      longitude in decimal degrees
 * @param accuracyMeters optional horizontal accuracy, drives the hysteresis
 * @param timestamp      optional event time, defaults to now
 */
public record EvaluateRequest(
    @NotBlank(message = "deviceId cannot be blank")
    String deviceId,

    String accountId,

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude,

    @PositiveOrZero(message = "Accuracy must be >= 0")
    Double accuracyMeters,

    Instant timestamp
) {

    public LocationSample toSample(Instant now) {
        return new LocationSample(deviceId, accountId, latitude, longitude, accuracyMeters, null,
            timestamp != null ? timestamp : now);
    }
}
