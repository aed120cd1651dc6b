package com.tapas.smartsales.olap.api.dto;

import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeCell;
import com.tapas.smartsales.olap.cube.CubeDimension;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CubeResponse(
        String cube,
        List<String> dimensions,
        BigDecimal totalSalesUsd,
        long transactionCount,
        List<CellResponse> cells
) {
    public record CellResponse(
            Map<String, Object> key,
            BigDecimal totalSalesUsd,
            long transactionCount,
            long totalQuantity,
            BigDecimal averageSaleUsd,
            List<Long> saleIds
    ) {}

    public static CubeResponse from(Cube cube) {
        List<CubeDimension> dimensions = cube.dimensions();
        return new CubeResponse(
                cube.name(),
                dimensions.stream().map(CubeDimension::columnName).toList(),
                cube.totalSalesUsd(),
                cube.transactionCount(),
                cube.cells().stream().map(cell -> toCell(dimensions, cell)).toList()
        );
    }

    private static CellResponse toCell(List<CubeDimension> dimensions, CubeCell cell) {
        Map<String, Object> key = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            key.put(dimensions.get(i).columnName(), cell.key().get(i));
        }
        return new CellResponse(
                key,
                cell.totalSalesUsd(),
                cell.transactionCount(),
                cell.totalQuantity(),
                cell.averageSaleUsd(),
                cell.saleIds()
        );
    }
}
