package com.tapas.smartsales.etl.source;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * One CSV row keyed by normalized header names. Lookups ignore case, underscores
 * and spaces, so {@code customer_id} also matches a {@code CustomerID} header.
 * Blank cells read as {@code null}.
 */
public final class CsvRow {

    private final int lineNumber;
    private final Map<String, String> values = new HashMap<>();

    public CsvRow(int lineNumber, Map<String, String> raw) {
        this.lineNumber = lineNumber;
        raw.forEach((header, value) -> values.put(normalize(header), value));
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String string(String... columns) {
        for (String column : columns) {
            String value = values.get(normalize(column));
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    public Long longValue(String... columns) {
        return parse(columns, value -> {
            // cleaned files sometimes carry integral ids as "1001.0"
            BigDecimal decimal = new BigDecimal(value);
            return decimal.longValueExact();
        });
    }

    public Integer integer(String... columns) {
        return parse(columns, value -> new BigDecimal(value).intValueExact());
    }

    public BigDecimal decimal(String... columns) {
        return parse(columns, BigDecimal::new);
    }

    public LocalDate date(String... columns) {
        return parse(columns, LocalDate::parse);
    }

    private <T> T parse(String[] columns, Function<String, T> parser) {
        String value = string(columns);
        if (value == null) {
            return null;
        }
        try {
            return parser.apply(value);
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            throw new MalformedRecordException(columns[0], value, e);
        }
    }

    private static String normalize(String header) {
        return header.replace("\uFEFF", "").replace("_", "").replace(" ", "").toLowerCase(Locale.ROOT);
    }
}
