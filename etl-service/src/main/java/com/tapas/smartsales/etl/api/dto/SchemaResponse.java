package com.tapas.smartsales.etl.api.dto;

import java.util.List;

public record SchemaResponse(
        boolean reset,
        boolean changed,
        List<String> differencesBefore
) {}
