package com.tapas.smartsales.etl.source;

import com.tapas.smartsales.etl.schema.StarSchema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record SaleRecord(
        Long saleId,
        Long customerId,
        Long productId,
        LocalDate saleDate,
        BigDecimal saleAmountUsd,
        Integer quantity,
        Long storeId,
        Long campaignId,
        BigDecimal discountPercent,
        String paymentType) implements CleanedRecord {

    /**
     * Shorthand for a sale carrying only the required attributes.
     */
    public static SaleRecord of(Long saleId, Long customerId, Long productId, LocalDate saleDate,
                                BigDecimal saleAmountUsd, Integer quantity) {
        return new SaleRecord(saleId, customerId, productId, saleDate, saleAmountUsd, quantity,
                null, null, null, null);
    }

    public static SaleRecord fromRow(CsvRow row) {
        return new SaleRecord(
                row.longValue("sale_id", "transaction_id"),
                row.longValue("customer_id"),
                row.longValue("product_id"),
                row.date("sale_date"),
                row.decimal("sale_amount_usd", "sale_amount"),
                row.integer("quantity"),
                row.longValue("store_id"),
                row.longValue("campaign_id"),
                row.decimal("discount_percent"),
                row.string("payment_type"));
    }

    @Override
    public String keyColumn() {
        return "sale_id";
    }

    @Override
    public Long key() {
        return saleId;
    }

    @Override
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (saleId == null) {
            violations.add("missing sale_id");
        }
        if (customerId == null) {
            violations.add("missing customer_id");
        }
        if (productId == null) {
            violations.add("missing product_id");
        }
        if (saleDate == null) {
            violations.add("missing sale_date");
        }
        if (saleAmountUsd == null) {
            violations.add("missing sale_amount_usd");
        } else if (saleAmountUsd.signum() < 0) {
            violations.add("negative sale_amount_usd " + saleAmountUsd.toPlainString());
        }
        if (quantity == null) {
            violations.add("missing quantity");
        } else if (quantity < 1) {
            violations.add("quantity must be at least 1, was " + quantity);
        }
        StarSchema.SALE_TABLE.checkRange("sale_amount_usd", saleAmountUsd, violations);
        StarSchema.SALE_TABLE.checkRange("discount_percent", discountPercent, violations);
        StarSchema.SALE_TABLE.checkRange("payment_type", paymentType, violations);
        return violations;
    }
}
