package com.tapas.smartsales.olap.export;

import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeBuilder;
import com.tapas.smartsales.olap.cube.CubeDefinition;
import com.tapas.smartsales.olap.fact.SaleFact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CubeCsvWriterTest {

    @TempDir
    Path tempDir;

    private final CubeCsvWriter writer = new CubeCsvWriter();

    @Test
    void writesOneRowPerCellWithSaleIds() throws IOException {
        Cube cube = new CubeBuilder().build(CubeDefinition.SALES_BY_QUARTER_CATEGORY, List.of(
                fact(2, "2024-07-20", "50.00", "Clothing"),
                fact(1, "2024-07-10", "100.00", "Clothing"),
                fact(3, "2024-10-01", "999.99", "Electronics"),
                fact(4, "2024-10-02", "5.00", null)));

        Path file = writer.write(cube, tempDir.resolve("cubes"));

        assertThat(file).isEqualTo(tempDir.resolve("cubes").resolve("sales_by_quarter_category.csv"));
        assertThat(Files.readAllLines(file)).containsExactly(
                "year,quarter,category,total_sales_usd,transaction_count,total_quantity,average_sale_usd,sale_ids",
                "2024,3,Clothing,150.00,2,2,75.00,1;2",
                "2024,4,Electronics,999.99,1,1,999.99,3",
                "2024,4,,5.00,1,1,5.00,4");
    }

    @Test
    void rewritingReplacesTheFile() throws IOException {
        CubeBuilder builder = new CubeBuilder();
        writer.write(builder.build(CubeDefinition.SALES_BY_QUARTER, List.of(
                fact(1, "2024-01-10", "1.00", "Toys"),
                fact(2, "2024-04-10", "1.00", "Toys"))), tempDir);

        Path file = writer.write(builder.build(CubeDefinition.SALES_BY_QUARTER, List.of(
                fact(1, "2024-01-10", "1.00", "Toys"))), tempDir);

        assertThat(Files.readAllLines(file)).hasSize(2);
    }

    private static SaleFact fact(long saleId, String date, String amount, String category) {
        return new SaleFact(saleId, LocalDate.parse(date), new BigDecimal(amount), 1, 1, 1, category, "North");
    }
}
