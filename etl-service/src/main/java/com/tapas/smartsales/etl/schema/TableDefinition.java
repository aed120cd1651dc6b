package com.tapas.smartsales.etl.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Declared structure of one warehouse table. The DDL is rendered from this
 * model, never inferred from data.
 */
public record TableDefinition(
        String name,
        List<ColumnDefinition> columns,
        String primaryKey,
        List<ForeignKey> foreignKeys,
        List<String> checks) {

    public TableDefinition {
        columns = List.copyOf(columns);
        foreignKeys = List.copyOf(foreignKeys);
        checks = List.copyOf(checks);
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnDefinition::name).toList();
    }

    public ColumnDefinition column(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No column " + columnName + " in table " + name));
    }

    /**
     * Adds to {@code violations} the reason, if any, the column cannot hold the value.
     */
    public void checkRange(String columnName, Object value, List<String> violations) {
        column(columnName).rangeViolation(value).ifPresent(violations::add);
    }

    public String createStatement() {
        List<String> parts = new ArrayList<>();
        columns.forEach(c -> parts.add(c.toDdl()));
        parts.add("PRIMARY KEY (" + primaryKey + ")");
        foreignKeys.forEach(fk -> parts.add(fk.toDdl()));
        checks.forEach(check -> parts.add("CHECK (" + check + ")"));

        StringJoiner body = new StringJoiner(",\n    ", "CREATE TABLE " + name + " (\n    ", "\n)");
        parts.forEach(body::add);
        return body.toString();
    }

    public String dropStatement() {
        return "DROP TABLE IF EXISTS " + name + " CASCADE";
    }
}
