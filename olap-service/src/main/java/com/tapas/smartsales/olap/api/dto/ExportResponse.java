package com.tapas.smartsales.olap.api.dto;

public record ExportResponse(
        String cube,
        String file
) {}
