package com.tapas.smartsales.etl.repository;

import com.tapas.smartsales.etl.source.CustomerRecord;
import com.tapas.smartsales.etl.source.ProductRecord;
import com.tapas.smartsales.etl.source.SaleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JDBC writes into the star schema. Upserts are done as UPDATE for keys already
 * present and INSERT for the rest, which every relational store understands.
 */
@Repository
public class WarehouseWriteRepository {

    private static final Logger log = LoggerFactory.getLogger(WarehouseWriteRepository.class);

    private static final int BATCH_SIZE = 500;

    private final JdbcTemplate jdbcTemplate;

    public WarehouseWriteRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsertCustomers(Collection<CustomerRecord> customers) {
        if (customers == null || customers.isEmpty()) {
            return;
        }

        Set<Long> existing = findCustomerIds();
        List<CustomerRecord> updates = new ArrayList<>();
        List<CustomerRecord> inserts = new ArrayList<>();
        for (CustomerRecord customer : customers) {
            (existing.contains(customer.customerId()) ? updates : inserts).add(customer);
        }

        String updateSql = """
                UPDATE customer
                SET name = ?, region = ?, join_date = ?, age = ?, preferred_contact = ?
                WHERE customer_id = ?
                """;
        jdbcTemplate.batchUpdate(updateSql, updates, BATCH_SIZE, (ps, c) -> {
            ps.setString(1, c.name());
            setNullable(ps, 2, c.region(), Types.VARCHAR);
            setNullable(ps, 3, c.joinDate() != null ? Date.valueOf(c.joinDate()) : null, Types.DATE);
            setNullable(ps, 4, c.age(), Types.INTEGER);
            setNullable(ps, 5, c.preferredContact(), Types.VARCHAR);
            ps.setLong(6, c.customerId());
        });

        String insertSql = """
                INSERT INTO customer (customer_id, name, region, join_date, age, preferred_contact)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        jdbcTemplate.batchUpdate(insertSql, inserts, BATCH_SIZE, (ps, c) -> {
            ps.setLong(1, c.customerId());
            ps.setString(2, c.name());
            setNullable(ps, 3, c.region(), Types.VARCHAR);
            setNullable(ps, 4, c.joinDate() != null ? Date.valueOf(c.joinDate()) : null, Types.DATE);
            setNullable(ps, 5, c.age(), Types.INTEGER);
            setNullable(ps, 6, c.preferredContact(), Types.VARCHAR);
        });

        log.debug("Upserted customers: {} updated, {} inserted", updates.size(), inserts.size());
    }

    public void upsertProducts(Collection<ProductRecord> products) {
        if (products == null || products.isEmpty()) {
            return;
        }

        Set<Long> existing = findProductIds();
        List<ProductRecord> updates = new ArrayList<>();
        List<ProductRecord> inserts = new ArrayList<>();
        for (ProductRecord product : products) {
            (existing.contains(product.productId()) ? updates : inserts).add(product);
        }

        String updateSql = """
                UPDATE product
                SET product_name = ?, category = ?, unit_price_usd = ?, stock = ?, supplier = ?
                WHERE product_id = ?
                """;
        jdbcTemplate.batchUpdate(updateSql, updates, BATCH_SIZE, (ps, p) -> {
            ps.setString(1, p.productName());
            setNullable(ps, 2, p.category(), Types.VARCHAR);
            ps.setBigDecimal(3, p.unitPriceUsd());
            setNullable(ps, 4, p.stock(), Types.INTEGER);
            setNullable(ps, 5, p.supplier(), Types.VARCHAR);
            ps.setLong(6, p.productId());
        });

        String insertSql = """
                INSERT INTO product (product_id, product_name, category, unit_price_usd, stock, supplier)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        jdbcTemplate.batchUpdate(insertSql, inserts, BATCH_SIZE, (ps, p) -> {
            ps.setLong(1, p.productId());
            ps.setString(2, p.productName());
            setNullable(ps, 3, p.category(), Types.VARCHAR);
            ps.setBigDecimal(4, p.unitPriceUsd());
            setNullable(ps, 5, p.stock(), Types.INTEGER);
            setNullable(ps, 6, p.supplier(), Types.VARCHAR);
        });

        log.debug("Upserted products: {} updated, {} inserted", updates.size(), inserts.size());
    }

    /**
     * Replaces the whole fact table with the given sales.
     */
    public void replaceSales(Collection<SaleRecord> sales) {
        int deleted = jdbcTemplate.update("DELETE FROM sale");
        log.debug("Cleared {} existing sales", deleted);

        if (sales == null || sales.isEmpty()) {
            return;
        }

        String insertSql = """
                INSERT INTO sale
                (sale_id, customer_id, product_id, sale_date, sale_amount_usd, quantity,
                 store_id, campaign_id, discount_percent, payment_type)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        jdbcTemplate.batchUpdate(insertSql, sales, BATCH_SIZE, (ps, s) -> {
            ps.setLong(1, s.saleId());
            ps.setLong(2, s.customerId());
            ps.setLong(3, s.productId());
            ps.setDate(4, Date.valueOf(s.saleDate()));
            ps.setBigDecimal(5, s.saleAmountUsd());
            ps.setInt(6, s.quantity());
            setNullable(ps, 7, s.storeId(), Types.BIGINT);
            setNullable(ps, 8, s.campaignId(), Types.BIGINT);
            setNullable(ps, 9, s.discountPercent(), Types.DECIMAL);
            setNullable(ps, 10, s.paymentType(), Types.VARCHAR);
        });

        log.debug("Inserted {} sales", sales.size());
    }

    public Set<Long> findCustomerIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT customer_id FROM customer", Long.class));
    }

    public Set<Long> findProductIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT product_id FROM product", Long.class));
    }

    private static void setNullable(PreparedStatement ps, int index, Object value, int sqlType) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType);
        } else {
            ps.setObject(index, value, sqlType);
        }
    }
}
