package com.tapas.smartsales.olap.repository;

import java.math.BigDecimal;

public record QuarterCategoryTotal(
        int year,
        int quarter,
        String category,
        BigDecimal totalSalesUsd,
        long transactionCount,
        long totalQuantity) {
}
