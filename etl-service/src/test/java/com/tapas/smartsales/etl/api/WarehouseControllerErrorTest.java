package com.tapas.smartsales.etl.api;

import com.tapas.smartsales.etl.loader.LoadReport;
import com.tapas.smartsales.etl.loader.LoadStage;
import com.tapas.smartsales.etl.loader.LoadStageException;
import com.tapas.smartsales.etl.service.EtlPipelineService;
import com.tapas.smartsales.etl.source.Rejection;
import com.tapas.smartsales.etl.source.SourceUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.web.servlet.MockMvc;

import java.io.FileNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WarehouseController.class)
class WarehouseControllerErrorTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EtlPipelineService pipelineService;

    @Test
    void unavailableSourceIsServiceUnavailable() throws Exception {
        when(pipelineService.load()).thenThrow(new SourceUnavailableException(
                "products", "file [data/prepared/products_data_prepared.csv]", new FileNotFoundException()));

        mockMvc.perform(post("/v1/warehouse/load"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("SOURCE_UNAVAILABLE"))
                .andExpect(jsonPath("$.source").value("products"));
    }

    @Test
    void failedStageIsUnprocessableWithThePartialReport() throws Exception {
        LoadReport partial = new LoadReport(Instant.parse("2024-11-01T10:00:00Z"), Duration.ofMillis(42),
                List.of(new LoadReport.StageResult(LoadStage.CUSTOMERS, 2, 0),
                        new LoadReport.StageResult(LoadStage.SALES, 0, 1)),
                List.of(new Rejection("sales", "sale_id=4", "unknown product_id 99")));
        when(pipelineService.load()).thenThrow(new LoadStageException(LoadStage.SALES, partial,
                new DataIntegrityViolationException("constraint violated")));

        mockMvc.perform(post("/v1/warehouse/load"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("LOAD_STAGE_FAILED"))
                .andExpect(jsonPath("$.report.status").value("ROLLED_BACK"))
                .andExpect(jsonPath("$.report.totalAccepted").value(2))
                .andExpect(jsonPath("$.report.rejections[0].recordKey").value("sale_id=4"));
    }
}
