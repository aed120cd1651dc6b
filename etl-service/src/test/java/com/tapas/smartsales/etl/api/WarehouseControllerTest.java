package com.tapas.smartsales.etl.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class WarehouseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void resetWarehouse() throws Exception {
        mockMvc.perform(post("/v1/warehouse/schema").param("reset", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reset").value(true))
                .andExpect(jsonPath("$.changed").value(true));
    }

    @Test
    void responsesAreWrittenWithTheJsonMapper() throws Exception {
        assertThat(objectMapper).isNotInstanceOf(CsvMapper.class);

        mockMvc.perform(get("/v1/warehouse/summary"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.sales").value(0));
    }

    @Test
    void defineSchemaIsANoOpWhenInPlace() throws Exception {
        mockMvc.perform(post("/v1/warehouse/schema"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.changed").value(false))
                .andExpect(jsonPath("$.differencesBefore", hasSize(0)));
    }

    @Test
    void loadReturnsTheReport() throws Exception {
        mockMvc.perform(post("/v1/warehouse/load"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.totalAccepted").value(7))
                .andExpect(jsonPath("$.totalRejected").value(2))
                .andExpect(jsonPath("$.stages[?(@.stage == 'SALES')].accepted").value(3))
                .andExpect(jsonPath("$.rejections[0].recordKey").value("line 6"))
                .andExpect(jsonPath("$.rejections[1].recordKey").value("sale_id=4"))
                .andExpect(jsonPath("$.rejections[1].reason").value("unknown product_id 99"));
    }

    @Test
    void summaryReflectsTheLoadedWarehouse() throws Exception {
        mockMvc.perform(post("/v1/warehouse/load")).andExpect(status().isOk());

        mockMvc.perform(get("/v1/warehouse/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.customers").value(2))
                .andExpect(jsonPath("$.products").value(2))
                .andExpect(jsonPath("$.sales").value(3))
                .andExpect(jsonPath("$.categories[0]").value("Clothing"))
                .andExpect(jsonPath("$.categories[1]").value("Electronics"))
                .andExpect(jsonPath("$.firstSaleDate").value("2024-07-10"))
                .andExpect(jsonPath("$.lastSaleDate").value("2024-10-01"));
    }

    @Test
    void loadAgainstAMismatchedSchemaIsAConflict() throws Exception {
        jdbcTemplate.execute("DROP TABLE sale");

        mockMvc.perform(post("/v1/warehouse/load"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("SCHEMA_MISMATCH"))
                .andExpect(jsonPath("$.differences[0]").value(containsString("sale")));
    }
}
