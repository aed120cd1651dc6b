package com.tapas.smartsales.etl.source;

import com.tapas.smartsales.etl.schema.StarSchema;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record CustomerRecord(
        Long customerId,
        String name,
        String region,
        LocalDate joinDate,
        Integer age,
        String preferredContact) implements CleanedRecord {

    public static CustomerRecord fromRow(CsvRow row) {
        return new CustomerRecord(
                row.longValue("customer_id"),
                row.string("name"),
                row.string("region"),
                row.date("join_date"),
                row.integer("age"),
                row.string("preferred_contact"));
    }

    @Override
    public String keyColumn() {
        return "customer_id";
    }

    @Override
    public Long key() {
        return customerId;
    }

    @Override
    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (customerId == null) {
            violations.add("missing customer_id");
        }
        if (name == null || name.isBlank()) {
            violations.add("missing name");
        }
        if (age != null && age < 0) {
            violations.add("negative age " + age);
        }
        StarSchema.CUSTOMER_TABLE.checkRange("name", name, violations);
        StarSchema.CUSTOMER_TABLE.checkRange("region", region, violations);
        StarSchema.CUSTOMER_TABLE.checkRange("preferred_contact", preferredContact, violations);
        return violations;
    }
}
