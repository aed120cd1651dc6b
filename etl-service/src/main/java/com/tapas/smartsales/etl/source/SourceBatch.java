package com.tapas.smartsales.etl.source;

import java.util.List;

/**
 * Everything read from one source: the records that could be built and the
 * rows that could not.
 */
public record SourceBatch<T extends CleanedRecord>(String source, List<T> records, List<Rejection> rejections) {

    public SourceBatch {
        records = List.copyOf(records);
        rejections = List.copyOf(rejections);
    }

    public static <T extends CleanedRecord> SourceBatch<T> of(String source, List<T> records) {
        return new SourceBatch<>(source, records, List.of());
    }
}
