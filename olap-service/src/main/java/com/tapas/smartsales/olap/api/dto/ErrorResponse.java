package com.tapas.smartsales.olap.api.dto;

public record ErrorResponse(
        String error,
        String message
) {}
