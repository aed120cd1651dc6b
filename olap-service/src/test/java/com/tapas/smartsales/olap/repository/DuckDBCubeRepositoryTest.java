package com.tapas.smartsales.olap.repository;

import com.tapas.smartsales.olap.config.DuckDBConfig;
import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeBuilder;
import com.tapas.smartsales.olap.cube.CubeDefinition;
import com.tapas.smartsales.olap.fact.SaleFact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DuckDBCubeRepositoryTest {

    @TempDir
    Path tempDir;

    private JdbcTemplate duckdbJdbcTemplate;
    private DuckDBCubeRepository repository;
    private final CubeBuilder builder = new CubeBuilder();

    private final List<SaleFact> facts = List.of(
            fact(1, "2024-07-10", "100.00", "Clothing"),
            fact(2, "2024-07-20", "50.00", "Clothing"),
            fact(3, "2024-10-01", "999.99", "Electronics"));

    @BeforeEach
    void setUp() {
        DuckDBConfig config = new DuckDBConfig(tempDir.resolve("olap").resolve("cubes.duckdb").toString());
        DataSource dataSource = config.duckdbDataSource();
        duckdbJdbcTemplate = new JdbcTemplate(dataSource);
        repository = new DuckDBCubeRepository(dataSource, duckdbJdbcTemplate);
    }

    @Test
    void materializesCubeAsTable() {
        Cube cube = builder.build(CubeDefinition.SALES_BY_QUARTER_CATEGORY, facts);

        int written = repository.materialize(cube);

        assertThat(written).isEqualTo(2);
        List<Map<String, Object>> rows = duckdbJdbcTemplate.queryForList(
                "SELECT * FROM cube_sales_by_quarter_category ORDER BY year, quarter, category");
        assertThat(rows).hasSize(2);
        Map<String, Object> first = rows.get(0);
        assertThat(((Number) first.get("year")).intValue()).isEqualTo(2024);
        assertThat(((Number) first.get("quarter")).intValue()).isEqualTo(3);
        assertThat(first.get("category")).isEqualTo("Clothing");
        assertThat((BigDecimal) first.get("total_sales_usd")).isEqualByComparingTo("150.00");
        assertThat(((Number) first.get("transaction_count")).longValue()).isEqualTo(2L);
        assertThat(first.get("sale_ids")).isEqualTo("1;2");
    }

    @Test
    void rematerializingReplacesTheTable() {
        Cube cube = builder.build(CubeDefinition.SALES_BY_QUARTER_CATEGORY, facts);

        repository.materialize(cube);
        repository.materialize(cube);

        assertThat(repository.countCells("sales_by_quarter_category")).isEqualTo(2);
        BigDecimal total = duckdbJdbcTemplate.queryForObject(
                "SELECT SUM(total_sales_usd) FROM cube_sales_by_quarter_category", BigDecimal.class);
        assertThat(total).isEqualByComparingTo("1149.99");
    }

    @Test
    void listsMaterializedCubes() {
        repository.materialize(builder.build(CubeDefinition.SALES_BY_QUARTER_CATEGORY, facts));
        repository.materialize(builder.build(CubeDefinition.SALES_BY_QUARTER, facts));

        assertThat(repository.findMaterializedCubes())
                .containsExactly("sales_by_quarter", "sales_by_quarter_category");
    }

    private static SaleFact fact(long saleId, String date, String amount, String category) {
        return new SaleFact(saleId, LocalDate.parse(date), new BigDecimal(amount), 1, 1, 1, category, "North");
    }
}
