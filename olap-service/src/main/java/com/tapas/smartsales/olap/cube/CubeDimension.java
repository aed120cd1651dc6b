package com.tapas.smartsales.olap.cube;

import com.tapas.smartsales.olap.fact.SaleFact;

import java.time.temporal.IsoFields;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of attributes a cube can group sales by.
 */
public enum CubeDimension {

    YEAR("year", "INTEGER", Integer.class, fact -> fact.saleDate().getYear()),
    QUARTER("quarter", "INTEGER", Integer.class, fact -> fact.saleDate().get(IsoFields.QUARTER_OF_YEAR)),
    MONTH("month", "INTEGER", Integer.class, fact -> fact.saleDate().getMonthValue()),
    // ISO numbering, Monday = 1
    DAY_OF_WEEK("day_of_week", "INTEGER", Integer.class, fact -> fact.saleDate().getDayOfWeek().getValue()),
    CATEGORY("category", "VARCHAR", String.class, SaleFact::category),
    REGION("region", "VARCHAR", String.class, SaleFact::region),
    PRODUCT_ID("product_id", "BIGINT", Long.class, SaleFact::productId),
    CUSTOMER_ID("customer_id", "BIGINT", Long.class, SaleFact::customerId);

    private final String columnName;
    private final String sqlType;
    private final Comparator<Object> valueOrder;
    private final Function<SaleFact, ? extends Comparable<?>> extractor;

    <T extends Comparable<? super T>> CubeDimension(
            String columnName, String sqlType, Class<T> valueType, Function<SaleFact, T> extractor) {
        this.columnName = columnName;
        this.sqlType = sqlType;
        Comparator<Object> byValue = Comparator.comparing(valueType::cast);
        this.valueOrder = Comparator.nullsLast(byValue);
        this.extractor = extractor;
    }

    public String columnName() {
        return columnName;
    }

    public String sqlType() {
        return sqlType;
    }

    /**
     * Natural order of this dimension's values, {@code null} last.
     */
    public Comparator<Object> valueOrder() {
        return valueOrder;
    }

    /**
     * @return the value of this dimension for the fact; {@code null} when the
     * joined attribute is absent (e.g. a product without category)
     */
    public Comparable<?> valueOf(SaleFact fact) {
        return extractor.apply(fact);
    }

    /**
     * Looks a dimension up by column name, ignoring case and accepting
     * {@code -} for {@code _}.
     *
     * @throws AggregationException if no such dimension exists
     */
    public static CubeDimension fromName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (CubeDimension dimension : values()) {
            if (dimension.columnName.equals(normalized)) {
                return dimension;
            }
        }
        throw new AggregationException("Undefined cube dimension '" + name + "', expected one of "
                + Arrays.stream(values()).map(CubeDimension::columnName).collect(Collectors.joining(", ")));
    }
}
