package com.tapas.smartsales.etl.schema;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record ColumnDefinition(String name, String sqlType, boolean nullable) {

    private static final Pattern VARCHAR = Pattern.compile("VARCHAR\\((\\d+)\\)");
    private static final Pattern DECIMAL = Pattern.compile("DECIMAL\\((\\d+),\\s*(\\d+)\\)");

    static ColumnDefinition required(String name, String sqlType) {
        return new ColumnDefinition(name, sqlType, false);
    }

    static ColumnDefinition optional(String name, String sqlType) {
        return new ColumnDefinition(name, sqlType, true);
    }

    String toDdl() {
        return nullable ? name + " " + sqlType : name + " " + sqlType + " NOT NULL";
    }

    /**
     * Checks a value against the length, precision and scale of the declared
     * type. Decimals with more fractional digits than the scale are refused
     * rather than rounded by the store.
     *
     * @return why the column cannot hold the value; empty for {@code null} and for types without limits
     */
    public Optional<String> rangeViolation(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        String type = sqlType.toUpperCase(Locale.ROOT);

        Matcher varchar = VARCHAR.matcher(type);
        if (varchar.matches() && value instanceof String) {
            String text = (String) value;
            int maxLength = Integer.parseInt(varchar.group(1));
            if (text.length() > maxLength) {
                return Optional.of(name + " longer than " + maxLength + " characters");
            }
            return Optional.empty();
        }

        Matcher decimal = DECIMAL.matcher(type);
        if (decimal.matches() && value instanceof BigDecimal) {
            BigDecimal number = (BigDecimal) value;
            int precision = Integer.parseInt(decimal.group(1));
            int scale = Integer.parseInt(decimal.group(2));
            BigDecimal stripped = number.stripTrailingZeros();
            if (stripped.scale() > scale) {
                return Optional.of(name + " " + number.toPlainString() + " has more than " + scale + " decimal places");
            }
            if (stripped.precision() - stripped.scale() > precision - scale) {
                return Optional.of(name + " " + number.toPlainString() + " exceeds " + sqlType);
            }
        }
        return Optional.empty();
    }
}
