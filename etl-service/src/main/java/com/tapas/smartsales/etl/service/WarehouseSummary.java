package com.tapas.smartsales.etl.service;

import java.time.LocalDate;
import java.util.List;

public record WarehouseSummary(
        long customerCount,
        long productCount,
        long saleCount,
        List<String> categories,
        LocalDate firstSaleDate,
        LocalDate lastSaleDate) {
}
