package com.fenceping.engine.exception;

/**
 * A stream record could not be turned into a location sample.
 */
public class MalformedSampleException extends RuntimeException {

    public MalformedSampleException(String message) {
        super(message);
    }

    public MalformedSampleException(String message, Throwable cause) {
        super(message, cause);
    }
}
