package com.tapas.smartsales.olap.service;

import java.math.BigDecimal;

/**
 * @param shareOfYearPercent this quarter's share of its year's total over the reported quarters
 * @param complete           whether the data covers the quarter up to its last day
 */
public record QuarterStaffing(
        int year,
        int quarter,
        BigDecimal totalSalesUsd,
        long transactionCount,
        BigDecimal shareOfYearPercent,
        boolean complete,
        StaffingLevel level) {
}
