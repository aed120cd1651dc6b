package com.tapas.smartsales.etl.source;

/**
 * A finite, already-cleaned tabular input (customers, products or sales).
 *
 * @param <T> record type produced by the source
 */
public interface RecordSource<T extends CleanedRecord> {

    String name();

    /**
     * Reads the whole source.
     *
     * @throws SourceUnavailableException if the source cannot be read at all
     */
    SourceBatch<T> read();
}
