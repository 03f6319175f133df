package com.fenceping.engine.geometry;

import com.fenceping.engine.exception.InvalidCoordinateException;
import com.fenceping.engine.model.GeoPoint;
import com.fenceping.engine.model.GeofenceGeometry;
import com.fenceping.engine.model.GeofenceKind;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts stored JTS geometries into the engine's tagged {@link GeofenceGeometry}.
 *
 * The declared kind wins: a geometry whose JTS type does not match the kind is rejected
 * instead of being reinterpreted.
 */
public final class GeofenceGeometryMapper {

    private GeofenceGeometryMapper() {
    }

    /**
     * @param kind                declared kind of the geofence
     * @param geometry            stored geometry (SRID 4326)
     * @param radiusMeters        stored radius, required for circles
     * @param defaultPointRadius  radius applied to point geofences without their own
     * @throws InvalidCoordinateException if the geometry breaks the invariants of its kind
     */
    public static GeofenceGeometry toGeofenceGeometry(GeofenceKind kind, Geometry geometry,
                                                      Double radiusMeters, double defaultPointRadius) {
        if (geometry == null || geometry.isEmpty()) {
            throw new InvalidCoordinateException("Geofence geometry is empty");
        }

        return switch (kind) {
            case CIRCLE -> GeofenceGeometry.circle(center(geometry, kind),
                radiusMeters == null ? 0 : radiusMeters);
            case POINT -> GeofenceGeometry.point(center(geometry, kind),
                radiusMeters == null || radiusMeters <= 0 ? defaultPointRadius : radiusMeters);
            case POLYGON -> {
                if (!(geometry instanceof Polygon polygon)) {
                    throw mismatch(kind, geometry);
                }
                yield GeofenceGeometry.polygon(rings(polygon));
            }
            case MULTIPOLYGON -> {
                if (geometry instanceof MultiPolygon multiPolygon) {
                    List<List<Coordinate[]>> polygons = new ArrayList<>();
                    for (int i = 0; i < multiPolygon.getNumGeometries(); i++) {
                        polygons.add(rings((Polygon) multiPolygon.getGeometryN(i)));
                    }
                    yield GeofenceGeometry.multiPolygon(polygons);
                }
                if (geometry instanceof Polygon polygon) {
                    yield GeofenceGeometry.multiPolygon(List.of(rings(polygon)));
                }
                throw mismatch(kind, geometry);
            }
        };
    }

    private static GeoPoint center(Geometry geometry, GeofenceKind kind) {
        if (!(geometry instanceof Point point)) {
            throw mismatch(kind, geometry);
        }
        GeoPoint center = GeoPoint.fromCoordinate(point.getCoordinate());
        GeometryEvaluator.validate(center);
        return center;
    }

    private static List<Coordinate[]> rings(Polygon polygon) {
        List<Coordinate[]> rings = new ArrayList<>(1 + polygon.getNumInteriorRing());
        rings.add(checkedRing(polygon.getExteriorRing().getCoordinates()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(checkedRing(polygon.getInteriorRingN(i).getCoordinates()));
        }
        return rings;
    }

    private static Coordinate[] checkedRing(Coordinate[] ring) {
        for (Coordinate c : ring) {
            GeometryEvaluator.validate(GeoPoint.fromCoordinate(c));
        }
        return ring;
    }

    private static InvalidCoordinateException mismatch(GeofenceKind kind, Geometry geometry) {
        return new InvalidCoordinateException(
            "Geometry type " + geometry.getGeometryType() + " does not match geofence kind " + kind.value());
    }
}
