package com.jctaxes.geometry;

/**
 * Thrown when a record's geometry is present but none of the known encodings apply, or decoding it fails.
 * The record is skipped and counted. This is never fatal to a run.
 */
public class GeometryParseException extends RuntimeException {

    public GeometryParseException (String message) {
        super(message);
    }

    public GeometryParseException (String message, Throwable cause) {
        super(message, cause);
    }

}
