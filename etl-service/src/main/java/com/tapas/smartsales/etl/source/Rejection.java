package com.tapas.smartsales.etl.source;

/**
 * One record refused by the ETL, with the key that identifies it and why.
 */
public record Rejection(String source, String recordKey, String reason) {

    @Override
    public String toString() {
        return source + "[" + recordKey + "]: " + reason;
    }
}
