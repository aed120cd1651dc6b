package com.tapas.smartsales.etl.loader;

import com.tapas.smartsales.etl.repository.WarehouseWriteRepository;
import com.tapas.smartsales.etl.schema.SchemaDefiner;
import com.tapas.smartsales.etl.source.CleanedRecord;
import com.tapas.smartsales.etl.source.CustomerRecord;
import com.tapas.smartsales.etl.source.ProductRecord;
import com.tapas.smartsales.etl.source.RecordSource;
import com.tapas.smartsales.etl.source.Rejection;
import com.tapas.smartsales.etl.source.SaleRecord;
import com.tapas.smartsales.etl.source.SourceBatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Loads cleaned customers, products and sales into the star schema.
 * <p>
 * All sources are read before anything is written. Dimensions are upserted by
 * natural key, sales are checked against the dimension keys present in the
 * warehouse and then replace the fact table. The writes share one transaction,
 * so running the loader twice on the same input leaves the same contents and a
 * reader never sees a half-loaded fact table.
 */
@Slf4j
@Service
public class WarehouseLoader {

    private final SchemaDefiner schemaDefiner;
    private final WarehouseWriteRepository writeRepository;
    private final TransactionTemplate transactionTemplate;

    // single writer
    private final ReentrantLock writerLock = new ReentrantLock();

    public WarehouseLoader(
            SchemaDefiner schemaDefiner,
            WarehouseWriteRepository writeRepository,
            PlatformTransactionManager transactionManager) {
        this.schemaDefiner = schemaDefiner;
        this.writeRepository = writeRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * @throws com.tapas.smartsales.etl.schema.SchemaMismatchException if the warehouse schema is wrong; nothing is read
     * @throws com.tapas.smartsales.etl.source.SourceUnavailableException if a source cannot be read; nothing is written
     * @throws LoadStageException if a write stage fails; the warehouse is rolled back
     */
    public LoadReport load(
            RecordSource<CustomerRecord> customerSource,
            RecordSource<ProductRecord> productSource,
            RecordSource<SaleRecord> saleSource) {

        writerLock.lock();
        try {
            schemaDefiner.verify();

            LoadReport.Builder report = LoadReport.builder();

            log.info("Reading cleaned sources");
            SourceBatch<CustomerRecord> customerBatch = customerSource.read();
            SourceBatch<ProductRecord> productBatch = productSource.read();
            SourceBatch<SaleRecord> saleBatch = saleSource.read();

            List<CustomerRecord> customers = validate(LoadStage.CUSTOMERS, customerBatch, report);
            List<ProductRecord> products = validate(LoadStage.PRODUCTS, productBatch, report);
            List<SaleRecord> sales = validate(LoadStage.SALES, saleBatch, report);

            transactionTemplate.executeWithoutResult(status -> {
                runStage(LoadStage.CUSTOMERS, report, () -> {
                    writeRepository.upsertCustomers(customers);
                    report.accept(LoadStage.CUSTOMERS, customers.size());
                });
                runStage(LoadStage.PRODUCTS, report, () -> {
                    writeRepository.upsertProducts(products);
                    report.accept(LoadStage.PRODUCTS, products.size());
                });
                runStage(LoadStage.SALES, report, () -> {
                    List<SaleRecord> resolved = resolveReferences(saleBatch.source(), sales, report);
                    writeRepository.replaceSales(resolved);
                    report.accept(LoadStage.SALES, resolved.size());
                });
            });

            LoadReport result = report.build();
            log.info("Load completed in {} ms: customers {}/{}, products {}/{}, sales {}/{} (accepted/rejected)",
                    result.elapsed().toMillis(),
                    result.accepted(LoadStage.CUSTOMERS), result.rejected(LoadStage.CUSTOMERS),
                    result.accepted(LoadStage.PRODUCTS), result.rejected(LoadStage.PRODUCTS),
                    result.accepted(LoadStage.SALES), result.rejected(LoadStage.SALES));
            return result;
        } finally {
            writerLock.unlock();
        }
    }

    private void runStage(LoadStage stage, LoadReport.Builder report, Runnable work) {
        log.info("Loading stage {}", stage);
        try {
            work.run();
        } catch (DataAccessException e) {
            log.error("Stage {} failed, rolling back the load", stage, e);
            throw new LoadStageException(stage, report.build(), e);
        }
    }

    /**
     * Drops records the source could not parse, records with missing or invalid
     * attributes, and repeated natural keys (the first occurrence wins).
     */
    private <T extends CleanedRecord> List<T> validate(LoadStage stage, SourceBatch<T> batch, LoadReport.Builder report) {
        batch.rejections().forEach(rejection -> report.reject(stage, rejection));

        List<T> valid = new ArrayList<>(batch.records().size());
        Set<Long> seen = new HashSet<>();
        for (T record : batch.records()) {
            List<String> violations = record.violations();
            if (!violations.isEmpty()) {
                report.reject(stage, new Rejection(batch.source(), record.describeKey(), String.join(", ", violations)));
            } else if (!seen.add(record.key())) {
                report.reject(stage, new Rejection(batch.source(), record.describeKey(),
                        "duplicate " + record.keyColumn() + " in source"));
            } else {
                valid.add(record);
            }
        }
        log.debug("Validated {}: {} valid of {} records", batch.source(), valid.size(), batch.records().size());
        return valid;
    }

    private List<SaleRecord> resolveReferences(String source, List<SaleRecord> sales, LoadReport.Builder report) {
        Set<Long> customerIds = writeRepository.findCustomerIds();
        Set<Long> productIds = writeRepository.findProductIds();

        List<SaleRecord> resolved = new ArrayList<>(sales.size());
        for (SaleRecord sale : sales) {
            List<String> dangling = new ArrayList<>(2);
            if (!customerIds.contains(sale.customerId())) {
                dangling.add("unknown customer_id " + sale.customerId());
            }
            if (!productIds.contains(sale.productId())) {
                dangling.add("unknown product_id " + sale.productId());
            }
            if (dangling.isEmpty()) {
                resolved.add(sale);
            } else {
                report.reject(LoadStage.SALES, new Rejection(source, sale.describeKey(), String.join(", ", dangling)));
            }
        }
        return resolved;
    }
}
