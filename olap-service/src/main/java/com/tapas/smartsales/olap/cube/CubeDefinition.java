package com.tapas.smartsales.olap.cube;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A named list of grouping dimensions. Dimension order is also the sort order
 * of the resulting cells.
 */
public record CubeDefinition(String name, List<CubeDimension> dimensions) {

    public static final CubeDefinition SALES_BY_QUARTER = new CubeDefinition(
            "sales_by_quarter", List.of(CubeDimension.YEAR, CubeDimension.QUARTER));

    public static final CubeDefinition SALES_BY_QUARTER_CATEGORY = new CubeDefinition(
            "sales_by_quarter_category", List.of(CubeDimension.YEAR, CubeDimension.QUARTER, CubeDimension.CATEGORY));

    private static final Map<String, CubeDefinition> NAMED = Map.of(
            SALES_BY_QUARTER.name(), SALES_BY_QUARTER,
            SALES_BY_QUARTER_CATEGORY.name(), SALES_BY_QUARTER_CATEGORY);

    public CubeDefinition {
        if (dimensions == null || dimensions.isEmpty()) {
            throw new AggregationException("Cube '" + name + "' needs at least one dimension");
        }
        Set<CubeDimension> distinct = EnumSet.copyOf(dimensions);
        if (distinct.size() != dimensions.size()) {
            throw new AggregationException("Cube '" + name + "' repeats a dimension: " + dimensions);
        }
        dimensions = List.copyOf(dimensions);
    }

    /**
     * @throws AggregationException for an unknown cube name
     */
    public static CubeDefinition named(String name) {
        CubeDefinition definition = NAMED.get(name);
        if (definition == null) {
            throw new AggregationException("Undefined cube '" + name + "', expected one of " + NAMED.keySet());
        }
        return definition;
    }

    /**
     * Builds a definition from dimension names, e.g. {@code quarter, product_id, customer_id}.
     * The cube is named after its dimensions: {@code sales_by_quarter_product_id_customer_id}.
     *
     * @throws AggregationException if a name is not a dimension
     */
    public static CubeDefinition of(List<String> dimensionNames) {
        if (dimensionNames == null || dimensionNames.isEmpty()) {
            throw new AggregationException("At least one cube dimension is required");
        }
        List<CubeDimension> dimensions = dimensionNames.stream().map(CubeDimension::fromName).toList();
        String name = "sales_by_" + dimensions.stream().map(CubeDimension::columnName).collect(Collectors.joining("_"));
        return new CubeDefinition(name, dimensions);
    }
}
