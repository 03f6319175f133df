package com.fenceping.engine.exception;

/**
 * A coordinate is out of range, or a geometry violates its structural invariants
 * (unclosed ring, too few vertices, non-positive radius).
 *
 * Never recoverable by retry: samples failing with this are dropped and counted.
 */
public class InvalidCoordinateException extends RuntimeException {

    public InvalidCoordinateException(String message) {
        super(message);
    }

    public static InvalidCoordinateException latitude(double latitude) {
        return new InvalidCoordinateException("Latitude out of range [-90, 90]: " + latitude);
    }

    public static InvalidCoordinateException longitude(double longitude) {
        return new InvalidCoordinateException("Longitude out of range [-180, 180]: " + longitude);
    }
}
