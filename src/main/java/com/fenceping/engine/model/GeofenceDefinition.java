package com.fenceping.engine.model;

/**
 * Read-only cached copy of a geofence owned by the CRUD system.
 *
 * @param id                    geofence id
 * @param accountId             owning account
 * @param name                  display name, used only for logging
 * @param geometry              tagged geometry
 * @param active                whether the geofence is evaluated at all
 * @param dwellThresholdSeconds dwell threshold; {@code null} disables dwell detection
 */
public record GeofenceDefinition(
    String id,
    String accountId,
    String name,
    GeofenceGeometry geometry,
    boolean active,
    Long dwellThresholdSeconds
) {

    public GeofenceKind kind() {
        return geometry.kind();
    }

    public boolean dwellEnabled() {
        return dwellThresholdSeconds != null && dwellThresholdSeconds > 0;
    }

    public String toLogString() {
        return String.format("Geofence[id=%s, kind=%s, name=%s]", id, kind().value(), name);
    }
}
