package com.tapas.smartsales.etl.schema;

import java.util.List;

/**
 * The backing store does not match the declared star schema.
 */
public class SchemaMismatchException extends RuntimeException {

    private final List<String> differences;

    public SchemaMismatchException(List<String> differences) {
        super("Warehouse schema does not match the star schema: " + String.join("; ", differences));
        this.differences = List.copyOf(differences);
    }

    public List<String> getDifferences() {
        return differences;
    }
}
