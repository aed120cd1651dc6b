package com.tapas.smartsales.olap.repository;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * The quarter by category cube computed by the warehouse itself, with
 * SQL-standard {@code EXTRACT} and {@code GROUP BY}.
 */
@Repository
public class WarehouseCubeQueryRepository {

    private final JdbcTemplate warehouseJdbcTemplate;

    public WarehouseCubeQueryRepository(@Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate) {
        this.warehouseJdbcTemplate = warehouseJdbcTemplate;
    }

    public List<QuarterCategoryTotal> salesByQuarterAndCategory() {
        String sql = """
                SELECT
                    EXTRACT(YEAR FROM s.sale_date)    AS sale_year,
                    EXTRACT(QUARTER FROM s.sale_date) AS sale_quarter,
                    p.category                        AS category,
                    SUM(s.sale_amount_usd)            AS total_sales_usd,
                    COUNT(*)                          AS transaction_count,
                    SUM(s.quantity)                   AS total_quantity
                FROM sale s
                JOIN product p ON p.product_id = s.product_id
                GROUP BY EXTRACT(YEAR FROM s.sale_date), EXTRACT(QUARTER FROM s.sale_date), p.category
                ORDER BY sale_year, sale_quarter, category NULLS LAST
                """;

        return warehouseJdbcTemplate.query(sql, (rs, rowNum) -> new QuarterCategoryTotal(
                rs.getInt("sale_year"),
                rs.getInt("sale_quarter"),
                rs.getString("category"),
                rs.getBigDecimal("total_sales_usd"),
                rs.getLong("transaction_count"),
                rs.getLong("total_quantity")));
    }
}
