package com.tapas.smartsales.etl.api;

import com.tapas.smartsales.etl.api.dto.ErrorResponse;
import com.tapas.smartsales.etl.api.dto.LoadReportResponse;
import com.tapas.smartsales.etl.api.dto.SchemaResponse;
import com.tapas.smartsales.etl.api.dto.WarehouseSummaryResponse;
import com.tapas.smartsales.etl.loader.LoadStageException;
import com.tapas.smartsales.etl.schema.SchemaMismatchException;
import com.tapas.smartsales.etl.service.EtlPipelineService;
import com.tapas.smartsales.etl.source.SourceUnavailableException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/warehouse")
public class WarehouseController {

    private static final Logger log = LoggerFactory.getLogger(WarehouseController.class);

    private final EtlPipelineService pipelineService;

    public WarehouseController(EtlPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    @Operation(
            summary = "Define the star schema",
            description = "Creates the customer, product and sale tables. No-op when they already match; "
                    + "reset=true drops and recreates them, leaving an empty warehouse."
    )
    @PostMapping("/schema")
    public SchemaResponse defineSchema(
            @Parameter(description = "Drop and recreate all tables", example = "false")
            @RequestParam(defaultValue = "false") boolean reset
    ) {
        List<String> differences = pipelineService.defineSchema(reset);
        return new SchemaResponse(reset, reset || !differences.isEmpty(), differences);
    }

    @Operation(
            summary = "Load the cleaned sources into the warehouse",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Load committed",
                            content = @Content(schema = @Schema(implementation = LoadReportResponse.class))),
                    @ApiResponse(responseCode = "409", description = "Warehouse schema does not match",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "422", description = "A load stage failed and was rolled back",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "503", description = "A source cannot be read",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    @PostMapping("/load")
    public LoadReportResponse load() {
        return LoadReportResponse.from("COMPLETED", pipelineService.load());
    }

    @Operation(summary = "Row counts, categories and sale date range of the warehouse")
    @GetMapping("/summary")
    public WarehouseSummaryResponse summary() {
        return WarehouseSummaryResponse.from(pipelineService.summary());
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ResponseEntity<ErrorResponse> sourceUnavailable(SourceUnavailableException e) {
        log.error("Load aborted: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("SOURCE_UNAVAILABLE", e.getMessage(), e.getSource(), null, null));
    }

    @ExceptionHandler(SchemaMismatchException.class)
    public ResponseEntity<ErrorResponse> schemaMismatch(SchemaMismatchException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("SCHEMA_MISMATCH", e.getMessage(), null, e.getDifferences(), null));
    }

    @ExceptionHandler(LoadStageException.class)
    public ResponseEntity<ErrorResponse> loadStageFailed(LoadStageException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse("LOAD_STAGE_FAILED", e.getMessage(), null, null,
                        LoadReportResponse.from("ROLLED_BACK", e.getReport())));
    }
}
