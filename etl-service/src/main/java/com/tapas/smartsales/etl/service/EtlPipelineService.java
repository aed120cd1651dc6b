package com.tapas.smartsales.etl.service;

import com.tapas.smartsales.etl.loader.LoadReport;
import com.tapas.smartsales.etl.loader.WarehouseLoader;
import com.tapas.smartsales.etl.repository.CustomerRepository;
import com.tapas.smartsales.etl.repository.ProductRepository;
import com.tapas.smartsales.etl.repository.SaleDateRange;
import com.tapas.smartsales.etl.repository.SaleRepository;
import com.tapas.smartsales.etl.schema.SchemaDefiner;
import com.tapas.smartsales.etl.source.CustomerRecord;
import com.tapas.smartsales.etl.source.ProductRecord;
import com.tapas.smartsales.etl.source.RecordSource;
import com.tapas.smartsales.etl.source.SaleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Runs the warehouse side of the pipeline against the configured sources:
 * schema definition, then loading.
 */
@Service
public class EtlPipelineService {

    private static final Logger log = LoggerFactory.getLogger(EtlPipelineService.class);

    private final SchemaDefiner schemaDefiner;
    private final WarehouseLoader loader;
    private final RecordSource<CustomerRecord> customerSource;
    private final RecordSource<ProductRecord> productSource;
    private final RecordSource<SaleRecord> saleSource;
    private final CustomerRepository customerRepository;
    private final ProductRepository productRepository;
    private final SaleRepository saleRepository;

    public EtlPipelineService(
            SchemaDefiner schemaDefiner,
            WarehouseLoader loader,
            RecordSource<CustomerRecord> customerSource,
            RecordSource<ProductRecord> productSource,
            RecordSource<SaleRecord> saleSource,
            CustomerRepository customerRepository,
            ProductRepository productRepository,
            SaleRepository saleRepository) {
        this.schemaDefiner = schemaDefiner;
        this.loader = loader;
        this.customerSource = customerSource;
        this.productSource = productSource;
        this.saleSource = saleSource;
        this.customerRepository = customerRepository;
        this.productRepository = productRepository;
        this.saleRepository = saleRepository;
    }

    /**
     * @return the differences found before the schema was (re)defined; empty when it was already in place
     */
    public List<String> defineSchema(boolean reset) {
        List<String> differences = schemaDefiner.differences();
        if (reset) {
            schemaDefiner.reset();
        } else {
            schemaDefiner.define();
        }
        return differences;
    }

    public LoadReport load() {
        log.info("Starting warehouse load from {}, {}, {}",
                customerSource.name(), productSource.name(), saleSource.name());
        return loader.load(customerSource, productSource, saleSource);
    }

    @Transactional(readOnly = true)
    public WarehouseSummary summary() {
        SaleDateRange range = saleRepository.findSaleDateRange();
        return new WarehouseSummary(
                customerRepository.count(),
                productRepository.count(),
                saleRepository.count(),
                productRepository.findCategories(),
                range != null ? range.getFirstSaleDate() : null,
                range != null ? range.getLastSaleDate() : null);
    }
}
