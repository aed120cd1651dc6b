package com.tapas.smartsales.olap.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeCell;
import com.tapas.smartsales.olap.cube.CubeDimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a cube to {@code <dir>/<cube name>.csv}: one column per dimension,
 * then the metrics and the contributing sale ids.
 */
@Component
public class CubeCsvWriter {

    private static final Logger logger = LoggerFactory.getLogger(CubeCsvWriter.class);

    static final List<String> METRIC_COLUMNS =
            List.of("total_sales_usd", "transaction_count", "total_quantity", "average_sale_usd", "sale_ids");

    private final CsvMapper csvMapper;

    public CubeCsvWriter() {
        this.csvMapper = CsvMapper.builder()
                .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
                .build();
    }

    public Path write(Cube cube, Path outputDir) {
        Path file = outputDir.resolve(cube.name() + ".csv");

        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        cube.dimensions().forEach(d -> schema.addColumn(d.columnName()));
        METRIC_COLUMNS.forEach(schema::addColumn);

        try {
            Files.createDirectories(outputDir);
            try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                 SequenceWriter rows = csvMapper.writer(schema.build()).writeValues(out)) {
                for (CubeCell cell : cube.cells()) {
                    rows.write(toRow(cube.dimensions(), cell));
                }
            }
        } catch (IOException e) {
            throw new CubeExportException("Cannot write cube " + cube.name() + " to " + file, e);
        }

        logger.info("Exported cube {} to {} ({} rows)", cube.name(), file, cube.cells().size());
        return file;
    }

    private static Map<String, Object> toRow(List<CubeDimension> dimensions, CubeCell cell) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            row.put(dimensions.get(i).columnName(), cell.key().get(i));
        }
        row.put("total_sales_usd", cell.totalSalesUsd());
        row.put("transaction_count", cell.transactionCount());
        row.put("total_quantity", cell.totalQuantity());
        row.put("average_sale_usd", cell.averageSaleUsd());
        row.put("sale_ids", cell.saleIds().stream().map(String::valueOf).collect(Collectors.joining(";")));
        return row;
    }
}
