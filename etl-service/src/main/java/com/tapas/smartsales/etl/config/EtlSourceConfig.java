package com.tapas.smartsales.etl.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.tapas.smartsales.etl.source.CsvRecordSource;
import com.tapas.smartsales.etl.source.CustomerRecord;
import com.tapas.smartsales.etl.source.ProductRecord;
import com.tapas.smartsales.etl.source.RecordSource;
import com.tapas.smartsales.etl.source.SaleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the three cleaned CSV sources the loader reads from.
 * <p>
 * The {@link CsvMapper} stays private to the sources: published as a bean it
 * would replace the JSON {@code ObjectMapper} Spring MVC writes responses with.
 */
@Configuration
public class EtlSourceConfig {

    private static final Logger log = LoggerFactory.getLogger(EtlSourceConfig.class);

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();

    @Bean
    public RecordSource<CustomerRecord> customerSource(
            EtlSourceProperties properties, ResourceLoader resourceLoader) {
        log.info("Customer source: {}", properties.customers());
        return new CsvRecordSource<>("customers",
                resourceLoader.getResource(properties.customers()), csvMapper, CustomerRecord::fromRow);
    }

    @Bean
    public RecordSource<ProductRecord> productSource(
            EtlSourceProperties properties, ResourceLoader resourceLoader) {
        log.info("Product source: {}", properties.products());
        return new CsvRecordSource<>("products",
                resourceLoader.getResource(properties.products()), csvMapper, ProductRecord::fromRow);
    }

    @Bean
    public RecordSource<SaleRecord> saleSource(
            EtlSourceProperties properties, ResourceLoader resourceLoader) {
        log.info("Sale source: {}", properties.sales());
        return new CsvRecordSource<>("sales",
                resourceLoader.getResource(properties.sales()), csvMapper, SaleRecord::fromRow);
    }
}
