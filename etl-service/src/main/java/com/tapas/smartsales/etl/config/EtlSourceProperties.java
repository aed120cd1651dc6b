package com.tapas.smartsales.etl.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Locations of the cleaned CSV tables produced by the data-preparation step.
 * Any Spring resource location is accepted ({@code file:}, {@code classpath:}).
 */
@Validated
@ConfigurationProperties("etl.sources")
public record EtlSourceProperties(
        @NotBlank @DefaultValue("file:data/prepared/customers_data_prepared.csv") String customers,
        @NotBlank @DefaultValue("file:data/prepared/products_data_prepared.csv") String products,
        @NotBlank @DefaultValue("file:data/prepared/sales_data_prepared.csv") String sales) {
}
