package com.tapas.smartsales.olap.service;

import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeBuilder;
import com.tapas.smartsales.olap.cube.CubeDefinition;
import com.tapas.smartsales.olap.export.CubeCsvWriter;
import com.tapas.smartsales.olap.fact.WarehouseFactRepository;
import com.tapas.smartsales.olap.repository.DuckDBCubeRepository;
import com.tapas.smartsales.olap.repository.QuarterCategoryTotal;
import com.tapas.smartsales.olap.repository.WarehouseCubeQueryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class CubeService {

    private static final Logger logger = LoggerFactory.getLogger(CubeService.class);

    private final WarehouseFactRepository factRepository;
    private final WarehouseCubeQueryRepository cubeQueryRepository;
    private final DuckDBCubeRepository duckDBCubeRepository;
    private final CubeBuilder cubeBuilder;
    private final CubeCsvWriter csvWriter;
    private final SeasonalStaffingReport staffingReport;
    private final Path exportDir;

    public CubeService(
            WarehouseFactRepository factRepository,
            WarehouseCubeQueryRepository cubeQueryRepository,
            DuckDBCubeRepository duckDBCubeRepository,
            CubeBuilder cubeBuilder,
            CubeCsvWriter csvWriter,
            SeasonalStaffingReport staffingReport,
            @Value("${cube.export-dir:data/olap/cubes}") String exportDir) {
        this.factRepository = factRepository;
        this.cubeQueryRepository = cubeQueryRepository;
        this.duckDBCubeRepository = duckDBCubeRepository;
        this.cubeBuilder = cubeBuilder;
        this.csvWriter = csvWriter;
        this.staffingReport = staffingReport;
        this.exportDir = Path.of(exportDir);
    }

    public Cube build(CubeDefinition definition) {
        return cubeBuilder.build(definition, factRepository.findAll());
    }

    public Cube salesByQuarter() {
        return build(CubeDefinition.SALES_BY_QUARTER);
    }

    public Cube salesByQuarterAndCategory() {
        return build(CubeDefinition.SALES_BY_QUARTER_CATEGORY);
    }

    /**
     * @throws com.tapas.smartsales.olap.cube.AggregationException if a name is not a dimension
     */
    public Cube adHoc(List<String> dimensionNames) {
        return build(CubeDefinition.of(dimensionNames));
    }

    public List<QuarterCategoryTotal> salesByQuarterAndCategoryInWarehouse() {
        return cubeQueryRepository.salesByQuarterAndCategory();
    }

    public int materialize(String cubeName) {
        Cube cube = build(CubeDefinition.named(cubeName));
        return duckDBCubeRepository.materialize(cube);
    }

    public Map<String, Long> materializedCubes() {
        Map<String, Long> cubes = new LinkedHashMap<>();
        for (String name : duckDBCubeRepository.findMaterializedCubes()) {
            cubes.put(name, duckDBCubeRepository.countCells(name));
        }
        return cubes;
    }

    public Path export(String cubeName) {
        Cube cube = build(CubeDefinition.named(cubeName));
        return csvWriter.write(cube, exportDir);
    }

    public StaffingReport staffingReport(boolean completeQuartersOnly, BigDecimal thresholdPercent) {
        logger.info("Generating seasonal staffing report (complete quarters only: {}, threshold {}%)",
                completeQuartersOnly, thresholdPercent);
        return staffingReport.generate(factRepository.findAll(), completeQuartersOnly, thresholdPercent);
    }
}
