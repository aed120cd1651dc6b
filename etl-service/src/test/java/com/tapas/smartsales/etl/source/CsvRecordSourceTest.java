package com.tapas.smartsales.etl.source;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvRecordSourceTest {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();

    @Test
    void readsCleanedCustomers() {
        CsvRecordSource<CustomerRecord> source = new CsvRecordSource<>("customers",
                new ClassPathResource("fixtures/customers.csv"), csvMapper, CustomerRecord::fromRow);

        SourceBatch<CustomerRecord> batch = source.read();

        assertThat(batch.rejections()).isEmpty();
        assertThat(batch.records()).containsExactly(
                new CustomerRecord(1L, "Alice Moreau", "North", LocalDate.of(2023, 1, 15), 34, "Email"),
                new CustomerRecord(2L, "Bob Chen", "South", LocalDate.of(2023, 3, 2), null, "Phone"));
    }

    @Test
    void acceptsRawHeaderNamesAndIntegralDecimals() {
        CsvRecordSource<SaleRecord> source = new CsvRecordSource<>("sales",
                new ClassPathResource("fixtures/sales_raw_headers.csv"), csvMapper, SaleRecord::fromRow);

        SourceBatch<SaleRecord> batch = source.read();

        assertThat(batch.rejections()).isEmpty();
        assertThat(batch.records()).hasSize(2);
        SaleRecord first = batch.records().get(0);
        assertThat(first.saleId()).isEqualTo(1001L);
        assertThat(first.saleDate()).isEqualTo(LocalDate.of(2024, 2, 15));
        assertThat(first.saleAmountUsd()).isEqualByComparingTo("75.50");
        assertThat(first.paymentType()).isEqualTo("CREDIT");
        assertThat(batch.records().get(1).paymentType()).isNull();
    }

    @Test
    void rejectsUnparsableRowsByLine() {
        CsvRecordSource<SaleRecord> source = new CsvRecordSource<>("sales",
                new ClassPathResource("fixtures/sales.csv"), csvMapper, SaleRecord::fromRow);

        SourceBatch<SaleRecord> batch = source.read();

        assertThat(batch.records()).extracting(SaleRecord::saleId).containsExactly(1L, 2L, 3L, 4L);
        assertThat(batch.rejections()).singleElement().satisfies(rejection -> {
            assertThat(rejection.source()).isEqualTo("sales");
            assertThat(rejection.recordKey()).isEqualTo("line 6");
            assertThat(rejection.reason()).contains("sale_date").contains("not-a-date");
        });
    }

    @Test
    void leavesValidationToTheLoader() {
        String csv = "product_id,product_name,category,unit_price_usd\n7,,Toys,-1.00\n";
        CsvRecordSource<ProductRecord> source = new CsvRecordSource<>("products",
                new ByteArrayResource(csv.getBytes(StandardCharsets.UTF_8)), csvMapper, ProductRecord::fromRow);

        ProductRecord product = source.read().records().get(0);

        assertThat(product.unitPriceUsd()).isEqualByComparingTo(new BigDecimal("-1.00"));
        assertThat(product.violations())
                .containsExactly("missing product_name", "negative unit_price_usd -1.00");
    }

    @Test
    void missingFileIsUnavailable() {
        CsvRecordSource<CustomerRecord> source = new CsvRecordSource<>("customers",
                new FileSystemResource("does/not/exist.csv"), csvMapper, CustomerRecord::fromRow);

        assertThatThrownBy(source::read)
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("customers")
                .satisfies(e -> assertThat(((SourceUnavailableException) e).getSource()).isEqualTo("customers"));
    }
}
