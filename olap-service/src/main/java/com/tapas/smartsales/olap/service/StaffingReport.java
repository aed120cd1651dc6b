package com.tapas.smartsales.olap.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * @param quarterAverageUsd mean quarterly sales over the reported quarters
 * @param excludedQuarters  quarters left out as incomplete, e.g. {@code 2024-Q4}
 */
public record StaffingReport(
        LocalDate lastSaleDate,
        BigDecimal thresholdPercent,
        BigDecimal quarterAverageUsd,
        List<QuarterStaffing> quarters,
        List<String> excludedQuarters) {

    public StaffingReport {
        quarters = List.copyOf(quarters);
        excludedQuarters = List.copyOf(excludedQuarters);
    }

    public boolean staffingChangeWarranted() {
        return quarters.stream().anyMatch(q -> q.level() != StaffingLevel.NORMAL);
    }
}
