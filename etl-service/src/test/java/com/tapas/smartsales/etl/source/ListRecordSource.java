package com.tapas.smartsales.etl.source;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory source for loader tests.
 */
public class ListRecordSource<T extends CleanedRecord> implements RecordSource<T> {

    private final String name;
    private final List<T> records;
    private final AtomicInteger reads = new AtomicInteger();

    public ListRecordSource(String name, List<T> records) {
        this.name = name;
        this.records = records;
    }

    @SafeVarargs
    public static <T extends CleanedRecord> ListRecordSource<T> of(String name, T... records) {
        return new ListRecordSource<>(name, List.of(records));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public SourceBatch<T> read() {
        reads.incrementAndGet();
        return SourceBatch.of(name, records);
    }

    public int reads() {
        return reads.get();
    }
}
