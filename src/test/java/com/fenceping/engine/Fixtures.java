package com.fenceping.engine;

import com.fenceping.engine.model.GeoPoint;
import com.fenceping.engine.model.GeofenceDefinition;
import com.fenceping.engine.model.GeofenceGeometry;
import com.fenceping.engine.model.LocationSample;
import org.locationtech.jts.geom.Coordinate;

import java.time.Instant;
import java.util.List;

/**
 * Shared builders for engine tests.
 */
public final class Fixtures {

    public static final String ACCOUNT = "3f2b6a10-8c4e-4d7a-9a51-0c6f4e2d9b11";
    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private Fixtures() {
    }

    /**
     * Closed counter-clockwise rectangle ring, coordinates in (lon, lat).
     */
    public static Coordinate[] rectangle(double minLon, double minLat, double maxLon, double maxLat) {
        return new Coordinate[] {
            new Coordinate(minLon, minLat),
            new Coordinate(maxLon, minLat),
            new Coordinate(maxLon, maxLat),
            new Coordinate(minLon, maxLat),
            new Coordinate(minLon, minLat)
        };
    }

    public static Coordinate[] reversed(Coordinate[] ring) {
        Coordinate[] copy = new Coordinate[ring.length];
        for (int i = 0; i < ring.length; i++) {
            copy[i] = ring[ring.length - 1 - i];
        }
        return copy;
    }

    public static GeofenceDefinition circle(String id, double lat, double lon, double radiusMeters) {
        return circle(id, lat, lon, radiusMeters, null);
    }

    public static GeofenceDefinition circle(String id, double lat, double lon, double radiusMeters, Long dwellSeconds) {
        return new GeofenceDefinition(id, ACCOUNT, "circle " + id,
            GeofenceGeometry.circle(GeoPoint.of(lat, lon), radiusMeters), true, dwellSeconds);
    }

    public static GeofenceDefinition polygon(String id, Coordinate[]... rings) {
        return new GeofenceDefinition(id, ACCOUNT, "polygon " + id,
            GeofenceGeometry.polygon(List.of(rings)), true, null);
    }

    public static LocationSample sample(String deviceId, double lat, double lon, Instant timestamp) {
        return new LocationSample(deviceId, ACCOUNT, lat, lon, null, null, timestamp);
    }

    public static LocationSample sample(String deviceId, double lat, double lon, Double accuracy, Instant timestamp) {
        return new LocationSample(deviceId, ACCOUNT, lat, lon, accuracy, null, timestamp);
    }
}
