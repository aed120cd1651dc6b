package com.tapas.smartsales.olap.cube;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated metrics for one combination of dimension values.
 *
 * @param key      dimension values in the cube's dimension order; an element is {@code null}
 *                 when the attribute is absent
 * @param saleIds  contributing sales, ascending
 */
public record CubeCell(
        List<Object> key,
        BigDecimal totalSalesUsd,
        long transactionCount,
        long totalQuantity,
        BigDecimal averageSaleUsd,
        List<Long> saleIds) {

    public CubeCell {
        key = Collections.unmodifiableList(key);
        saleIds = List.copyOf(saleIds);
    }
}
