package com.tapas.smartsales.etl.config;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * The star-schema warehouse the loader writes to, bound from
 * {@code spring.datasource.*} (PostgreSQL in production, H2 in tests).
 * <p>
 * {@code SchemaDefiner} and the loader write through the {@link JdbcTemplate};
 * the JPA repositories behind the warehouse summary read the loaded tables.
 * Every bean is primary so Spring Boot's JPA and transaction auto-configuration
 * bind to this store.
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
