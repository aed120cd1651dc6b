package com.tapas.smartsales.olap.api.dto;

public record MaterializationResponse(
        String cube,
        String table,
        int cells
) {}
