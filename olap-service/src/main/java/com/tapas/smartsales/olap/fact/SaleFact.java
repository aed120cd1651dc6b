package com.tapas.smartsales.olap.fact;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One sale joined with the dimension attributes the cubes group by.
 */
public record SaleFact(
        long saleId,
        LocalDate saleDate,
        BigDecimal saleAmountUsd,
        int quantity,
        long customerId,
        long productId,
        String category,
        String region) {
}
