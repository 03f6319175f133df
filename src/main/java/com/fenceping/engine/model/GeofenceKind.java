package com.fenceping.engine.model;

import java.util.Locale;

/**
 * Tag of a geofence geometry. The evaluator dispatches on this tag.
 */
public enum GeofenceKind {
    CIRCLE,
    POLYGON,
    MULTIPOLYGON,
    POINT;

    public static GeofenceKind fromValue(String value) {
        return GeofenceKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
