package com.fenceping.engine.geometry;

import com.fenceping.engine.exception.InvalidCoordinateException;
import com.fenceping.engine.model.GeoPoint;
import com.fenceping.engine.model.GeofenceGeometry;
import org.locationtech.jts.algorithm.RayCrossingCounter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Location;

import java.util.List;

/**
 * Pure spatial functions used by the state tracker.
 *
 * Supports:
 *  - Great-circle distance (haversine) between two coordinates
 *  - Containment for circle, point, polygon and multipolygon geofences
 *  - Distance from a point to a geofence boundary, used by the accuracy hysteresis
 *
 * Stateless and side-effect free; safe to call from any number of threads.
 */
public final class GeometryEvaluator {

    // Earth's mean radius in meters
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    private GeometryEvaluator() {
    }

    /**
     * Haversine distance between two coordinates.
     *
     * The intermediate term is clamped to [0, 1] so that rounding cannot push
     * {@code sqrt(1 - a)} to NaN for antipodal points.
     *
     * @return distance in meters
     * @throws InvalidCoordinateException if either coordinate is out of range
     */
    public static double distanceMeters(GeoPoint a, GeoPoint b) {
        validate(a);
        validate(b);

        double lat1 = Math.toRadians(a.latitude());
        double lat2 = Math.toRadians(b.latitude());
        double deltaLat = lat2 - lat1;
        double deltaLon = Math.toRadians(b.longitude() - a.longitude());

        double sinLat = Math.sin(deltaLat / 2);
        double sinLon = Math.sin(deltaLon / 2);
        double h = sinLat * sinLat + Math.cos(lat1) * Math.cos(lat2) * sinLon * sinLon;
        h = Math.min(1.0, Math.max(0.0, h));

        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Whether the point lies inside the geometry. Boundary points count as inside.
     *
     * @throws InvalidCoordinateException if the point is out of range
     */
    public static boolean contains(GeofenceGeometry geometry, GeoPoint point) {
        validate(point);
        return switch (geometry.kind()) {
            case CIRCLE, POINT -> distanceMeters(geometry.center(), point) <= geometry.radiusMeters();
            case POLYGON, MULTIPOLYGON -> anyPolygonContains(geometry.polygons(), point.toCoordinate());
        };
    }

    /**
     * Approximate distance in meters from the point to the nearest boundary of the geometry,
     * regardless of whether the point is inside or outside.
     */
    public static double distanceToBoundaryMeters(GeofenceGeometry geometry, GeoPoint point) {
        validate(point);
        return switch (geometry.kind()) {
            case CIRCLE, POINT -> Math.abs(distanceMeters(geometry.center(), point) - geometry.radiusMeters());
            case POLYGON, MULTIPOLYGON -> nearestRingDistance(geometry.polygons(), point);
        };
    }

    /**
     * Checks latitude in [-90, 90] and longitude in [-180, 180]; NaN and infinities fail too.
     */
    public static void validate(GeoPoint point) {
        if (!(point.latitude() >= -90.0 && point.latitude() <= 90.0)) {
            throw InvalidCoordinateException.latitude(point.latitude());
        }
        if (!(point.longitude() >= -180.0 && point.longitude() <= 180.0)) {
            throw InvalidCoordinateException.longitude(point.longitude());
        }
    }

    private static boolean anyPolygonContains(List<List<Coordinate[]>> polygons, Coordinate p) {
        for (List<Coordinate[]> rings : polygons) {
            if (polygonContains(rings, p)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Even-odd rule across the rings of one polygon: inside an odd number of rings means
     * contained, so a point inside the outer ring and inside a hole ring is outside.
     * Rings are evaluated as given; self-intersecting rings are not repaired.
     */
    private static boolean polygonContains(List<Coordinate[]> rings, Coordinate p) {
        int enclosing = 0;
        for (Coordinate[] ring : rings) {
            int location = RayCrossingCounter.locatePointInRing(p, ring);
            if (location == Location.BOUNDARY) {
                return true;
            }
            if (location == Location.INTERIOR) {
                enclosing++;
            }
        }
        return enclosing % 2 == 1;
    }

    private static double nearestRingDistance(List<List<Coordinate[]>> polygons, GeoPoint point) {
        double best = Double.MAX_VALUE;
        for (List<Coordinate[]> rings : polygons) {
            for (Coordinate[] ring : rings) {
                for (int i = 0; i + 1 < ring.length; i++) {
                    best = Math.min(best, segmentDistanceMeters(point, ring[i], ring[i + 1]));
                }
            }
        }
        return best;
    }

    /**
     * Point-to-segment distance on a local equirectangular projection centred on the point.
     * Accurate enough for hysteresis margins of a few hundred meters.
     */
    private static double segmentDistanceMeters(GeoPoint origin, Coordinate start, Coordinate end) {
        double cosLat = Math.cos(Math.toRadians(origin.latitude()));
        double[] a = project(origin, start, cosLat);
        double[] b = project(origin, end, cosLat);

        double dx = b[0] - a[0];
        double dy = b[1] - a[1];
        double lengthSquared = dx * dx + dy * dy;
        double t = lengthSquared == 0 ? 0 : -(a[0] * dx + a[1] * dy) / lengthSquared;
        t = Math.max(0, Math.min(1, t));

        double x = a[0] + t * dx;
        double y = a[1] + t * dy;
        return Math.sqrt(x * x + y * y);
    }

    private static double[] project(GeoPoint origin, Coordinate c, double cosLat) {
        double deltaLon = c.getX() - origin.longitude();
        // Shortest way round across the antimeridian
        if (deltaLon > 180) {
            deltaLon -= 360;
        } else if (deltaLon < -180) {
            deltaLon += 360;
        }
        double metersPerDegree = Math.toRadians(1) * EARTH_RADIUS_METERS;
        return new double[] {
            deltaLon * cosLat * metersPerDegree,
            (c.getY() - origin.latitude()) * metersPerDegree
        };
    }
}
