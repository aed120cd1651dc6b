package com.tapas.smartsales.olap.api;

import com.tapas.smartsales.olap.api.dto.CubeResponse;
import com.tapas.smartsales.olap.api.dto.ErrorResponse;
import com.tapas.smartsales.olap.api.dto.ExportResponse;
import com.tapas.smartsales.olap.api.dto.MaterializationResponse;
import com.tapas.smartsales.olap.cube.AggregationException;
import com.tapas.smartsales.olap.export.CubeExportException;
import com.tapas.smartsales.olap.repository.DuckDBCubeRepository;
import com.tapas.smartsales.olap.repository.QuarterCategoryTotal;
import com.tapas.smartsales.olap.service.CubeService;
import com.tapas.smartsales.olap.service.StaffingReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/cubes")
public class CubeController {

    private static final Logger logger = LoggerFactory.getLogger(CubeController.class);

    private final CubeService service;

    public CubeController(CubeService service) {
        this.service = service;
    }

    @Operation(
            summary = "Sales by quarter",
            description = "Total sales and transaction count per (year, quarter). Only quarters with sales appear.",
            responses = {
                    @ApiResponse(
                            responseCode = "200",
                            description = "Successful response",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = CubeResponse.class),
                                    examples = @ExampleObject(
                                            name = "salesByQuarterExample",
                                            value = "{\n  \"cube\": \"sales_by_quarter\",\n  \"dimensions\": [\"year\", \"quarter\"],\n  \"totalSalesUsd\": 150.00,\n  \"transactionCount\": 2,\n  \"cells\": [{\n    \"key\": {\"year\": 2024, \"quarter\": 3},\n    \"totalSalesUsd\": 150.00,\n    \"transactionCount\": 2,\n    \"totalQuantity\": 6,\n    \"averageSaleUsd\": 75.00,\n    \"saleIds\": [1, 2]\n  }]\n}"
                                    )
                            )
                    )
            }
    )
    @GetMapping("/sales-by-quarter")
    public CubeResponse salesByQuarter() {
        return CubeResponse.from(service.salesByQuarter());
    }

    @Operation(
            summary = "Sales by quarter and product category",
            description = "Total sales and transaction count per (year, quarter, category)."
    )
    @GetMapping("/sales-by-quarter-category")
    public CubeResponse salesByQuarterAndCategory() {
        return CubeResponse.from(service.salesByQuarterAndCategory());
    }

    @Operation(
            summary = "Sales by quarter and product category, computed in the warehouse",
            description = "The same aggregation as /sales-by-quarter-category expressed as a SQL GROUP BY."
    )
    @GetMapping("/sales-by-quarter-category/sql")
    public List<QuarterCategoryTotal> salesByQuarterAndCategoryInWarehouse() {
        return service.salesByQuarterAndCategoryInWarehouse();
    }

    @Operation(
            summary = "Ad-hoc cube",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Successful response",
                            content = @Content(schema = @Schema(implementation = CubeResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Undefined dimension",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    @GetMapping
    public CubeResponse adHoc(
            @Parameter(description = "Dimensions to group by, in sort order. One of year, quarter, month, "
                    + "day_of_week, category, region, product_id, customer_id", example = "quarter,product_id,customer_id")
            @RequestParam List<String> dimensions
    ) {
        return CubeResponse.from(service.adHoc(dimensions));
    }

    @Operation(summary = "Materialize a named cube into DuckDB as cube_<name>")
    @PostMapping("/{name}/materialize")
    public MaterializationResponse materialize(
            @Parameter(description = "Cube name", example = "sales_by_quarter_category")
            @PathVariable String name
    ) {
        int cells = service.materialize(name);
        return new MaterializationResponse(name, DuckDBCubeRepository.tableName(name), cells);
    }

    @Operation(summary = "Cubes materialized in DuckDB, with their cell counts")
    @GetMapping("/materialized")
    public Map<String, Long> materialized() {
        return service.materializedCubes();
    }

    @Operation(summary = "Export a named cube as CSV to the configured export directory")
    @PostMapping("/{name}/export")
    public ExportResponse export(
            @Parameter(description = "Cube name", example = "sales_by_quarter")
            @PathVariable String name
    ) {
        return new ExportResponse(name, service.export(name).toString());
    }

    @Operation(
            summary = "Seasonal staffing report",
            description = "Quarterly sales with share of the year and PEAK / NORMAL / LOW flags relative to the "
                    + "quarterly mean."
    )
    @GetMapping("/seasonal-staffing")
    public StaffingReport seasonalStaffing(
            @Parameter(description = "Leave out quarters the data does not cover up to their last day", example = "true")
            @RequestParam(defaultValue = "false") boolean completeQuartersOnly,
            @Parameter(description = "Deviation from the quarterly mean, in percent, that flags a quarter", example = "10")
            @RequestParam(defaultValue = "10") BigDecimal thresholdPercent
    ) {
        return service.staffingReport(completeQuartersOnly, thresholdPercent);
    }

    @ExceptionHandler(AggregationException.class)
    public ResponseEntity<ErrorResponse> aggregationFailed(AggregationException e) {
        logger.warn("Cube request rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse("AGGREGATION_ERROR", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(CubeExportException.class)
    public ResponseEntity<ErrorResponse> exportFailed(CubeExportException e) {
        logger.error("Cube export failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("EXPORT_FAILED", e.getMessage()));
    }
}
