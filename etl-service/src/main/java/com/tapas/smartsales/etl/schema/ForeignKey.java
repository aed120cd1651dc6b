package com.tapas.smartsales.etl.schema;

public record ForeignKey(String constraintName, String column, String referencedTable, String referencedColumn) {

    String toDdl() {
        return "CONSTRAINT " + constraintName + " FOREIGN KEY (" + column + ") REFERENCES "
                + referencedTable + " (" + referencedColumn + ")";
    }
}
