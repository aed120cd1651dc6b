package com.tapas.smartsales.etl.source;

import java.util.List;

/**
 * A type-normalized row of one of the cleaned tables.
 */
public interface CleanedRecord {

    /**
     * @return natural key column name, e.g. {@code customer_id}
     */
    String keyColumn();

    /**
     * @return natural key value, {@code null} when the row lacks one
     */
    Long key();

    /**
     * @return reasons the record cannot be loaded; empty when it is valid
     */
    List<String> violations();

    default String describeKey() {
        return keyColumn() + "=" + key();
    }
}
