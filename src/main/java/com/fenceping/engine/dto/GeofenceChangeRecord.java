package com.fenceping.engine.dto;

/**
 * Change notification published by the geofence CRUD system.
 *
 * @param accountId  account whose geofences changed; {@code null} means all accounts
 * @param geofenceId changed geofence, informational only
 * @param change     created, updated or deleted
 */
public record GeofenceChangeRecord(String accountId, String geofenceId, String change) {
}
