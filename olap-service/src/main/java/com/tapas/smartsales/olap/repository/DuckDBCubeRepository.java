package com.tapas.smartsales.olap.repository;

import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeCell;
import com.tapas.smartsales.olap.cube.CubeDimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * Writes cubes to DuckDB as {@code cube_<name>} tables. Each materialization
 * replaces the table in one transaction, so running it twice leaves the same
 * table.
 */
@Repository
public class DuckDBCubeRepository {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBCubeRepository.class);

    public static final String TABLE_PREFIX = "cube_";

    private static final int BATCH_SIZE = 1000;

    private final JdbcTemplate duckdbJdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public DuckDBCubeRepository(
            @Qualifier("duckdbDataSource") DataSource duckdbDataSource,
            @Qualifier("duckdbJdbcTemplate") JdbcTemplate duckdbJdbcTemplate) {
        this.duckdbJdbcTemplate = duckdbJdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(duckdbDataSource));
    }

    public static String tableName(String cubeName) {
        return TABLE_PREFIX + cubeName;
    }

    /**
     * @return number of cells written
     */
    public int materialize(Cube cube) {
        String table = tableName(cube.name());
        List<CubeDimension> dimensions = cube.dimensions();

        StringJoiner columns = new StringJoiner(",\n    ", "CREATE OR REPLACE TABLE " + table + " (\n    ", "\n)");
        dimensions.forEach(d -> columns.add(d.columnName() + " " + d.sqlType()));
        columns.add("total_sales_usd DECIMAL(18,2) NOT NULL");
        columns.add("transaction_count BIGINT NOT NULL");
        columns.add("total_quantity BIGINT NOT NULL");
        columns.add("average_sale_usd DECIMAL(18,2) NOT NULL");
        columns.add("sale_ids VARCHAR NOT NULL");

        int columnCount = dimensions.size() + 5;
        String insertSql = "INSERT INTO " + table + " VALUES ("
                + String.join(", ", Collections.nCopies(columnCount, "?")) + ")";

        transactionTemplate.executeWithoutResult(status -> {
            duckdbJdbcTemplate.execute(columns.toString());
            duckdbJdbcTemplate.batchUpdate(insertSql, cube.cells(), BATCH_SIZE, (ps, cell) -> {
                int index = 1;
                for (Object value : cell.key()) {
                    ps.setObject(index++, value);
                }
                ps.setBigDecimal(index++, cell.totalSalesUsd());
                ps.setLong(index++, cell.transactionCount());
                ps.setLong(index++, cell.totalQuantity());
                ps.setBigDecimal(index++, cell.averageSaleUsd());
                ps.setString(index, joinSaleIds(cell));
            });
        });

        logger.info("Materialized cube {} into DuckDB table {} ({} cells)", cube.name(), table, cube.cells().size());
        return cube.cells().size();
    }

    /**
     * @return names of the cubes currently materialized, without the table prefix
     */
    public List<String> findMaterializedCubes() {
        List<String> tables = duckdbJdbcTemplate.queryForList(
                "SELECT table_name FROM information_schema.tables WHERE starts_with(table_name, ?) ORDER BY table_name",
                String.class, TABLE_PREFIX);
        List<String> cubes = new ArrayList<>(tables.size());
        tables.forEach(t -> cubes.add(t.substring(TABLE_PREFIX.length())));
        return cubes;
    }

    public long countCells(String cubeName) {
        Long count = duckdbJdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName(cubeName), Long.class);
        return count != null ? count : 0;
    }

    static String joinSaleIds(CubeCell cell) {
        return cell.saleIds().stream().map(String::valueOf).collect(Collectors.joining(";"));
    }
}
