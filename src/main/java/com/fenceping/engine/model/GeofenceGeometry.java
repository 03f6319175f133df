package com.fenceping.engine.model;

import com.fenceping.engine.exception.InvalidCoordinateException;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Tagged geometry of a geofence.
 *
 * <ul>
 *   <li>{@code CIRCLE} / {@code POINT}: {@code center} and {@code radiusMeters} are set, {@code polygons} is empty.</li>
 *   <li>{@code POLYGON}: exactly one polygon, made of one or more closed rings.</li>
 *   <li>{@code MULTIPOLYGON}: one or more polygons.</li>
 * </ul>
 *
 * Rings are JTS coordinate arrays in (longitude, latitude) order. Within a polygon the
 * rings are combined with the even-odd rule, so any ring after the first acts as a hole.
 * Instances are immutable once built through the factories; the arrays must not be modified.
 */
public record GeofenceGeometry(
    GeofenceKind kind,
    GeoPoint center,
    double radiusMeters,
    List<List<Coordinate[]>> polygons
) {

    public static final int MIN_RING_SIZE = 4;

    public static GeofenceGeometry circle(GeoPoint center, double radiusMeters) {
        requireCenter(center);
        if (!(radiusMeters > 0)) {
            throw new InvalidCoordinateException("Circle radius must be positive: " + radiusMeters);
        }
        return new GeofenceGeometry(GeofenceKind.CIRCLE, center, radiusMeters, List.of());
    }

    public static GeofenceGeometry point(GeoPoint center, double radiusMeters) {
        requireCenter(center);
        if (radiusMeters < 0) {
            throw new InvalidCoordinateException("Point radius must not be negative: " + radiusMeters);
        }
        return new GeofenceGeometry(GeofenceKind.POINT, center, radiusMeters, List.of());
    }

    public static GeofenceGeometry polygon(List<Coordinate[]> rings) {
        return new GeofenceGeometry(GeofenceKind.POLYGON, null, 0, List.of(validatePolygon(rings)));
    }

    public static GeofenceGeometry multiPolygon(List<List<Coordinate[]>> polygons) {
        if (polygons == null || polygons.isEmpty()) {
            throw new InvalidCoordinateException("Multipolygon needs at least one polygon");
        }
        List<List<Coordinate[]>> validated = polygons.stream()
            .map(GeofenceGeometry::validatePolygon)
            .toList();
        return new GeofenceGeometry(GeofenceKind.MULTIPOLYGON, null, 0, validated);
    }

    public boolean isRadial() {
        return kind == GeofenceKind.CIRCLE || kind == GeofenceKind.POINT;
    }

    public int ringCount() {
        return polygons.stream().mapToInt(List::size).sum();
    }

    private static void requireCenter(GeoPoint center) {
        if (center == null) {
            throw new InvalidCoordinateException("Radial geofence needs a center point");
        }
    }

    private static List<Coordinate[]> validatePolygon(List<Coordinate[]> rings) {
        if (rings == null || rings.isEmpty()) {
            throw new InvalidCoordinateException("Polygon needs at least one ring");
        }
        for (Coordinate[] ring : rings) {
            if (ring == null || ring.length < MIN_RING_SIZE) {
                throw new InvalidCoordinateException(
                    "Polygon ring needs at least " + MIN_RING_SIZE + " coordinates");
            }
            if (!ring[0].equals2D(ring[ring.length - 1])) {
                throw new InvalidCoordinateException("Polygon ring is not closed");
            }
        }
        return List.copyOf(rings);
    }
}
