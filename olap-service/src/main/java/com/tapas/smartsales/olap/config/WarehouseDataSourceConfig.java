package com.tapas.smartsales.olap.config;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Read side of the star-schema warehouse filled by the etl-service, bound from
 * {@code spring.datasource.*}.
 * <p>
 * {@code WarehouseFactRepository} joins {@code sale} with its dimensions
 * through this template to feed the in-memory cube builder, and
 * {@code WarehouseCubeQueryRepository} runs the SQL {@code GROUP BY} rendition
 * of the quarter by category cube against it. The beans are primary so that
 * injection points without a qualifier get the warehouse, never the DuckDB
 * cube store.
 */
@Configuration
public class WarehouseDataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource")
    public DataSourceProperties warehouseDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    public DataSource warehouseDataSource() {
        return warehouseDataSourceProperties()
                .initializeDataSourceBuilder()
                .build();
    }

    @Bean
    @Primary
    public JdbcTemplate warehouseJdbcTemplate() {
        return new JdbcTemplate(warehouseDataSource());
    }
}
