package com.jctaxes.geometry;

/** Thrown when a record carries no geometry at all. The record is skipped. */
public class MissingGeometryException extends RuntimeException {

    public MissingGeometryException (String message) {
        super(message);
    }

}
