package com.jctaxes.datasource;

/** A problem reading one of the input data sets. */
public class DataSourceException extends RuntimeException {

    public DataSourceException (String message) {
        super(message);
    }

    public DataSourceException (String message, Throwable cause) {
        super(message, cause);
    }

}
