package com.tapas.smartsales.etl.schema;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnDefinitionTest {

    private final ColumnDefinition amount = StarSchema.SALE_TABLE.column("sale_amount_usd");
    private final ColumnDefinition name = StarSchema.CUSTOMER_TABLE.column("name");

    @Test
    void decimalsWithinPrecisionAndScaleFit() {
        assertThat(amount.rangeViolation(new BigDecimal("999999999999.99"))).isEmpty();
        assertThat(amount.rangeViolation(new BigDecimal("12.500"))).isEmpty();
        assertThat(amount.rangeViolation(BigDecimal.ZERO)).isEmpty();
        assertThat(amount.rangeViolation(null)).isEmpty();
    }

    @Test
    void decimalsBeyondPrecisionOrScaleDoNot() {
        assertThat(amount.rangeViolation(new BigDecimal("1000000000000")))
                .hasValue("sale_amount_usd 1000000000000 exceeds DECIMAL(14,2)");
        assertThat(amount.rangeViolation(new BigDecimal("1.999")))
                .hasValue("sale_amount_usd 1.999 has more than 2 decimal places");
    }

    @Test
    void textIsLimitedToTheVarcharLength() {
        assertThat(name.rangeViolation("x".repeat(255))).isEmpty();
        assertThat(name.rangeViolation("x".repeat(256))).hasValue("name longer than 255 characters");
    }

    @Test
    void typesWithoutLimitsAcceptAnyValue() {
        assertThat(StarSchema.SALE_TABLE.column("quantity").rangeViolation(Integer.MAX_VALUE)).isEmpty();
    }

    @Test
    void unknownColumnIsRefused() {
        assertThatThrownBy(() -> StarSchema.SALE_TABLE.column("colour"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No column colour in table sale");
    }
}
