package com.fenceping.engine.service;

import com.fenceping.engine.exception.GeofenceLoadException;
import com.fenceping.engine.model.GeofenceDefinition;

import java.util.List;

/**
 * Narrow read contract onto the geofence source of truth owned by the CRUD system.
 */
public interface GeofenceSource {

    /**
     * Active geofences of the account; empty when it has none.
     *
     * @throws GeofenceLoadException if the source cannot be reached
     */
    List<GeofenceDefinition> listActiveGeofences(String accountId);
}
