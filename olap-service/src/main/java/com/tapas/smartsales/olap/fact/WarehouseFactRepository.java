package com.tapas.smartsales.olap.fact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Reads sales together with their product and customer attributes. A single
 * SELECT, so a concurrent load is seen either entirely or not at all.
 */
@Repository
public class WarehouseFactRepository {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseFactRepository.class);

    private final JdbcTemplate warehouseJdbcTemplate;

    public WarehouseFactRepository(@Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate) {
        this.warehouseJdbcTemplate = warehouseJdbcTemplate;
    }

    public List<SaleFact> findAll() {
        String sql = """
                SELECT s.sale_id, s.sale_date, s.sale_amount_usd, s.quantity,
                       s.customer_id, s.product_id, p.category, c.region
                FROM sale s
                JOIN product p ON p.product_id = s.product_id
                JOIN customer c ON c.customer_id = s.customer_id
                ORDER BY s.sale_id
                """;

        List<SaleFact> facts = warehouseJdbcTemplate.query(sql, (rs, rowNum) -> new SaleFact(
                rs.getLong("sale_id"),
                rs.getDate("sale_date").toLocalDate(),
                rs.getBigDecimal("sale_amount_usd"),
                rs.getInt("quantity"),
                rs.getLong("customer_id"),
                rs.getLong("product_id"),
                rs.getString("category"),
                rs.getString("region")));

        logger.debug("Read {} sale facts from the warehouse", facts.size());
        return facts;
    }
}
