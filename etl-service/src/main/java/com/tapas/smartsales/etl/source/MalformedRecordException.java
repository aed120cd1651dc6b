package com.tapas.smartsales.etl.source;

/**
 * A single row carries a value that cannot be converted to its column type.
 */
public class MalformedRecordException extends RuntimeException {

    public MalformedRecordException(String column, String value, Throwable cause) {
        super("column " + column + " has unparsable value '" + value + "'", cause);
    }
}
