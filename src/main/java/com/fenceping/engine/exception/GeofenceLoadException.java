package com.fenceping.engine.exception;

/**
 * The geofence source of truth could not be reached. Retryable.
 */
public class GeofenceLoadException extends RuntimeException {

    public GeofenceLoadException(String accountId, Throwable cause) {
        super("Failed to load geofences for account " + accountId, cause);
    }
}
