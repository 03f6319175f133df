package com.fenceping.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GeofenceEventType {
    ENTER,
    EXIT,
    DWELL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GeofenceEventType fromValue(String value) {
        return GeofenceEventType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
