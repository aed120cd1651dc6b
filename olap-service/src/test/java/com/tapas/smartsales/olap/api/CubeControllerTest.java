package com.tapas.smartsales.olap.api;

import com.tapas.smartsales.olap.cube.AggregationException;
import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeBuilder;
import com.tapas.smartsales.olap.cube.CubeDefinition;
import com.tapas.smartsales.olap.fact.SaleFact;
import com.tapas.smartsales.olap.service.CubeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CubeController.class)
class CubeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CubeService service;

    private final List<SaleFact> facts = List.of(
            new SaleFact(1, LocalDate.parse("2024-07-10"), new BigDecimal("100.00"), 4, 1, 1, "Clothing", "North"),
            new SaleFact(2, LocalDate.parse("2024-07-20"), new BigDecimal("50.00"), 2, 1, 1, "Clothing", "North"));

    @Test
    void salesByQuarterCategoryReturnsCells() throws Exception {
        Cube cube = new CubeBuilder().build(CubeDefinition.SALES_BY_QUARTER_CATEGORY, facts);
        when(service.salesByQuarterAndCategory()).thenReturn(cube);

        mockMvc.perform(get("/api/cubes/sales-by-quarter-category"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cube").value("sales_by_quarter_category"))
                .andExpect(jsonPath("$.dimensions[2]").value("category"))
                .andExpect(jsonPath("$.cells.length()").value(1))
                .andExpect(jsonPath("$.cells[0].key.year").value(2024))
                .andExpect(jsonPath("$.cells[0].key.quarter").value(3))
                .andExpect(jsonPath("$.cells[0].key.category").value("Clothing"))
                .andExpect(jsonPath("$.cells[0].totalSalesUsd").value(150.00))
                .andExpect(jsonPath("$.cells[0].transactionCount").value(2))
                .andExpect(jsonPath("$.cells[0].saleIds[1]").value(2));
    }

    @Test
    void undefinedDimensionIsABadRequest() throws Exception {
        when(service.adHoc(anyList())).thenThrow(new AggregationException("Undefined cube dimension 'colour'"));

        mockMvc.perform(get("/api/cubes").param("dimensions", "quarter,colour"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("AGGREGATION_ERROR"))
                .andExpect(jsonPath("$.message").value("Undefined cube dimension 'colour'"));
    }

    @Test
    void materializeNamesTheTable() throws Exception {
        when(service.materialize("sales_by_quarter")).thenReturn(3);

        mockMvc.perform(post("/api/cubes/sales_by_quarter/materialize"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.table").value("cube_sales_by_quarter"))
                .andExpect(jsonPath("$.cells").value(3));
    }

    @Test
    void unknownCubeCannotBeMaterialized() throws Exception {
        when(service.materialize("sales_by_week")).thenThrow(new AggregationException("Undefined cube 'sales_by_week'"));

        mockMvc.perform(post("/api/cubes/sales_by_week/materialize"))
                .andExpect(status().isBadRequest());
    }
}
