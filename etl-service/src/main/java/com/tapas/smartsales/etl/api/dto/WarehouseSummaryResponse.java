package com.tapas.smartsales.etl.api.dto;

import com.tapas.smartsales.etl.service.WarehouseSummary;

import java.time.LocalDate;
import java.util.List;

public record WarehouseSummaryResponse(
        long customers,
        long products,
        long sales,
        List<String> categories,
        LocalDate firstSaleDate,
        LocalDate lastSaleDate
) {
    public static WarehouseSummaryResponse from(WarehouseSummary summary) {
        return new WarehouseSummaryResponse(
                summary.customerCount(),
                summary.productCount(),
                summary.saleCount(),
                summary.categories(),
                summary.firstSaleDate(),
                summary.lastSaleDate()
        );
    }
}
