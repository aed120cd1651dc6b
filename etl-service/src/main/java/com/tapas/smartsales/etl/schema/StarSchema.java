package com.tapas.smartsales.etl.schema;

import java.util.List;

import static com.tapas.smartsales.etl.schema.ColumnDefinition.optional;
import static com.tapas.smartsales.etl.schema.ColumnDefinition.required;

/**
 * The sales star schema: two dimensions ({@code customer}, {@code product}) and
 * one fact table ({@code sale}) referencing both.
 * <p>
 * Table and column names are the contract with reporting tools.
 */
public final class StarSchema {

    public static final String CUSTOMER = "customer";
    public static final String PRODUCT = "product";
    public static final String SALE = "sale";

    public static final TableDefinition CUSTOMER_TABLE = new TableDefinition(
            CUSTOMER,
            List.of(
                    required("customer_id", "BIGINT"),
                    required("name", "VARCHAR(255)"),
                    optional("region", "VARCHAR(100)"),
                    optional("join_date", "DATE"),
                    optional("age", "INTEGER"),
                    optional("preferred_contact", "VARCHAR(50)")),
            "customer_id",
            List.of(),
            List.of());

    public static final TableDefinition PRODUCT_TABLE = new TableDefinition(
            PRODUCT,
            List.of(
                    required("product_id", "BIGINT"),
                    required("product_name", "VARCHAR(255)"),
                    optional("category", "VARCHAR(100)"),
                    required("unit_price_usd", "DECIMAL(12,2)"),
                    optional("stock", "INTEGER"),
                    optional("supplier", "VARCHAR(255)")),
            "product_id",
            List.of(),
            List.of("unit_price_usd >= 0"));

    public static final TableDefinition SALE_TABLE = new TableDefinition(
            SALE,
            List.of(
                    required("sale_id", "BIGINT"),
                    required("customer_id", "BIGINT"),
                    required("product_id", "BIGINT"),
                    required("sale_date", "DATE"),
                    required("sale_amount_usd", "DECIMAL(14,2)"),
                    required("quantity", "INTEGER"),
                    optional("store_id", "BIGINT"),
                    optional("campaign_id", "BIGINT"),
                    optional("discount_percent", "DECIMAL(5,2)"),
                    optional("payment_type", "VARCHAR(50)")),
            "sale_id",
            List.of(
                    new ForeignKey("fk_sale_customer", "customer_id", CUSTOMER, "customer_id"),
                    new ForeignKey("fk_sale_product", "product_id", PRODUCT, "product_id")),
            List.of("sale_amount_usd >= 0", "quantity >= 1"));

    /**
     * Creation order: dimensions before the fact table.
     */
    public static final List<TableDefinition> TABLES = List.of(CUSTOMER_TABLE, PRODUCT_TABLE, SALE_TABLE);

    private StarSchema() {
    }

    /**
     * Drop order: the fact table first so no foreign key blocks a dimension drop.
     */
    public static List<TableDefinition> dropOrder() {
        return List.of(SALE_TABLE, PRODUCT_TABLE, CUSTOMER_TABLE);
    }
}
