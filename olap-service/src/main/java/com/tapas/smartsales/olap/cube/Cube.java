package com.tapas.smartsales.olap.cube;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public record Cube(CubeDefinition definition, List<CubeCell> cells) {

    public Cube {
        cells = List.copyOf(cells);
    }

    public String name() {
        return definition.name();
    }

    public List<CubeDimension> dimensions() {
        return definition.dimensions();
    }

    public Optional<CubeCell> cell(Object... key) {
        List<Object> wanted = Arrays.asList(key);
        return cells.stream().filter(cell -> cell.key().equals(wanted)).findFirst();
    }

    public Object value(CubeCell cell, CubeDimension dimension) {
        int index = dimensions().indexOf(dimension);
        if (index < 0) {
            throw new AggregationException("Cube '" + name() + "' is not grouped by " + dimension.columnName());
        }
        return cell.key().get(index);
    }

    public BigDecimal totalSalesUsd() {
        return cells.stream().map(CubeCell::totalSalesUsd).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public long transactionCount() {
        return cells.stream().mapToLong(CubeCell::transactionCount).sum();
    }
}
