package com.tapas.smartsales.etl.source;

/**
 * A required input source cannot be read. Fatal to the current load.
 */
public class SourceUnavailableException extends RuntimeException {

    private final String source;

    public SourceUnavailableException(String source, String location, Throwable cause) {
        super("Source '" + source + "' cannot be read from " + location
                + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
