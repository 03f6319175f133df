package com.fenceping.engine.model;

import org.locationtech.jts.geom.Coordinate;

/**
 * WGS84 coordinate in decimal degrees.
 *
 * Range checks are not done here: {@link com.fenceping.engine.geometry.GeometryEvaluator}
 * validates coordinates at the point of use so that a bad sample fails with
 * {@link com.fenceping.engine.exception.InvalidCoordinateException} instead of at parse time.
 *
 * @param latitude  latitude, expected in [-90, 90]
 * @param longitude longitude, expected in [-180, 180]
 */
public record GeoPoint(double latitude, double longitude) {

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * JTS uses (x, y) = (longitude, latitude) order.
     */
    public Coordinate toCoordinate() {
        return new Coordinate(longitude, latitude);
    }

    public static GeoPoint fromCoordinate(Coordinate coordinate) {
        return new GeoPoint(coordinate.getY(), coordinate.getX());
    }

    @Override
    public String toString() {
        return String.format("(%.6f, %.6f)", latitude, longitude);
    }
}
