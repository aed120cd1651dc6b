package com.tapas.smartsales.etl.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Creates, resets and verifies the star schema in the warehouse.
 * <p>
 * The store is compared against {@link StarSchema} through JDBC metadata
 * (tables, columns, primary keys, foreign keys), so the check works on any
 * relational store regardless of identifier case.
 * <p>
 * Drops and creates run in one transaction, so stores with transactional DDL
 * never keep a partial schema. The result is verified afterwards for stores
 * that commit each statement.
 */
@Component
public class SchemaDefiner {

    private static final Logger log = LoggerFactory.getLogger(SchemaDefiner.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public SchemaDefiner(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Makes the store match the star schema. No-op when it already does,
     * otherwise drops whatever part exists and recreates all tables.
     */
    public void define() {
        List<String> differences = differences();
        if (differences.isEmpty()) {
            log.info("Star schema already in place, nothing to define");
            return;
        }
        log.info("Star schema differs from the store ({}), recreating", differences);
        recreate();
    }

    /**
     * Drops and recreates all tables, leaving an empty warehouse.
     */
    public void reset() {
        log.info("Resetting star schema");
        recreate();
    }

    /**
     * @throws SchemaMismatchException if the store does not match the star schema
     */
    public void verify() {
        List<String> differences = differences();
        if (!differences.isEmpty()) {
            log.error("Schema verification failed: {}", differences);
            throw new SchemaMismatchException(differences);
        }
        log.debug("Schema verified");
    }

    public List<String> differences() {
        return jdbcTemplate.execute((ConnectionCallback<List<String>>) this::compare);
    }

    /**
     * @throws org.springframework.dao.DataAccessException if a statement fails; the transaction is rolled back
     * @throws SchemaMismatchException if the store still differs once all statements ran
     */
    private void recreate() {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                for (TableDefinition table : StarSchema.dropOrder()) {
                    jdbcTemplate.execute(table.dropStatement());
                }
                for (TableDefinition table : StarSchema.TABLES) {
                    jdbcTemplate.execute(table.createStatement());
                    log.info("{} table created", table.name());
                }
            });
        } catch (DataAccessException e) {
            log.error("Recreating the star schema failed, rolled back", e);
            throw e;
        }
        verify();
    }

    private List<String> compare(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String catalog = connection.getCatalog();
        String schema = connection.getSchema();

        List<String> differences = new ArrayList<>();
        for (TableDefinition table : StarSchema.TABLES) {
            String tableName = storedIdentifier(metaData, table.name());

            Set<String> columns = read(metaData.getColumns(catalog, schema, tableName, null),
                    rs -> rs.getString("COLUMN_NAME"));
            if (columns.isEmpty()) {
                differences.add("table " + table.name() + " is missing");
                continue;
            }

            Set<String> declared = new LinkedHashSet<>(table.columnNames());
            for (String column : declared) {
                if (!columns.contains(column)) {
                    differences.add("table " + table.name() + " lacks column " + column);
                }
            }
            for (String column : columns) {
                if (!declared.contains(column)) {
                    differences.add("table " + table.name() + " has undeclared column " + column);
                }
            }

            Set<String> primaryKey = read(metaData.getPrimaryKeys(catalog, schema, tableName),
                    rs -> rs.getString("COLUMN_NAME"));
            if (!primaryKey.equals(Set.of(table.primaryKey()))) {
                differences.add("table " + table.name() + " primary key is " + primaryKey
                        + ", expected [" + table.primaryKey() + "]");
            }

            Set<String> foreignKeys = read(metaData.getImportedKeys(catalog, schema, tableName),
                    rs -> rs.getString("FKCOLUMN_NAME") + "->" + rs.getString("PKTABLE_NAME"));
            for (ForeignKey fk : table.foreignKeys()) {
                String expected = (fk.column() + "->" + fk.referencedTable()).toLowerCase(Locale.ROOT);
                if (!foreignKeys.contains(expected)) {
                    differences.add("table " + table.name() + " lacks foreign key " + fk.column()
                            + " -> " + fk.referencedTable());
                }
            }
        }
        return differences;
    }

    private static String storedIdentifier(DatabaseMetaData metaData, String name) throws SQLException {
        if (metaData.storesUpperCaseIdentifiers()) {
            return name.toUpperCase(Locale.ROOT);
        }
        if (metaData.storesLowerCaseIdentifiers()) {
            return name.toLowerCase(Locale.ROOT);
        }
        return name;
    }

    private static Set<String> read(ResultSet resultSet, MetaDataValue value) throws SQLException {
        Set<String> values = new LinkedHashSet<>();
        try (ResultSet rs = resultSet) {
            while (rs.next()) {
                values.add(value.from(rs).toLowerCase(Locale.ROOT));
            }
        }
        return values;
    }

    @FunctionalInterface
    private interface MetaDataValue {
        String from(ResultSet rs) throws SQLException;
    }
}
