package com.tapas.smartsales.etl.source;

import com.tapas.smartsales.etl.schema.StarSchema;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public record ProductRecord(
        Long productId,
        String productName,
        String category,
        BigDecimal unitPriceUsd,
        Integer stock,
        String supplier) implements CleanedRecord {

    public static ProductRecord fromRow(CsvRow row) {
        return new ProductRecord(
                row.longValue("product_id"),
                row.string("product_name", "name"),
                row.string("category"),
                row.decimal("unit_price_usd", "unit_price"),
                row.integer("stock", "stock_quantity"),
                row.string("supplier"));
    }

    @Override
    public String keyColumn() {
        return "product_id";
    }

    @Override
    public Long key() {
        return productId;
    }

    @Override
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (productId == null) {
            violations.add("missing product_id");
        }
        if (productName == null || productName.isBlank()) {
            violations.add("missing product_name");
        }
        if (unitPriceUsd == null) {
            violations.add("missing unit_price_usd");
        } else if (unitPriceUsd.signum() < 0) {
            violations.add("negative unit_price_usd " + unitPriceUsd.toPlainString());
        }
        StarSchema.PRODUCT_TABLE.checkRange("product_name", productName, violations);
        StarSchema.PRODUCT_TABLE.checkRange("category", category, violations);
        StarSchema.PRODUCT_TABLE.checkRange("unit_price_usd", unitPriceUsd, violations);
        StarSchema.PRODUCT_TABLE.checkRange("supplier", supplier, violations);
        return violations;
    }
}
