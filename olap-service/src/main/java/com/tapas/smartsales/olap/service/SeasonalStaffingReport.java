package com.tapas.smartsales.olap.service;

import com.tapas.smartsales.olap.cube.Cube;
import com.tapas.smartsales.olap.cube.CubeBuilder;
import com.tapas.smartsales.olap.cube.CubeCell;
import com.tapas.smartsales.olap.cube.CubeDefinition;
import com.tapas.smartsales.olap.cube.CubeDimension;
import com.tapas.smartsales.olap.fact.SaleFact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers whether seasonal staffing changes are warranted: quarterly sales
 * from the {@code sales_by_quarter} cube, each quarter's share of its year, and
 * a PEAK / LOW flag for quarters that deviate from the quarterly mean by more
 * than the threshold.
 * <p>
 * A quarter is complete when the latest sale in the data falls on or after its
 * last day. Incomplete quarters are reported unless the caller asks for
 * complete quarters only.
 */
@Slf4j
@Component
public class SeasonalStaffingReport {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CubeBuilder cubeBuilder;

    public SeasonalStaffingReport(CubeBuilder cubeBuilder) {
        this.cubeBuilder = cubeBuilder;
    }

    public StaffingReport generate(Collection<SaleFact> facts, boolean completeQuartersOnly, BigDecimal thresholdPercent) {
        if (thresholdPercent == null || thresholdPercent.signum() < 0) {
            throw new IllegalArgumentException("thresholdPercent must be zero or positive, was " + thresholdPercent);
        }

        LocalDate lastSaleDate = facts.stream().map(SaleFact::saleDate).max(LocalDate::compareTo).orElse(null);
        Cube byQuarter = cubeBuilder.build(CubeDefinition.SALES_BY_QUARTER, facts);

        List<CubeCell> reported = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        for (CubeCell cell : byQuarter.cells()) {
            int year = year(byQuarter, cell);
            int quarter = quarter(byQuarter, cell);
            if (completeQuartersOnly && !isComplete(year, quarter, lastSaleDate)) {
                excluded.add(year + "-Q" + quarter);
            } else {
                reported.add(cell);
            }
        }
        if (!excluded.isEmpty()) {
            log.info("Excluding incomplete quarters {} (last sale {})", excluded, lastSaleDate);
        }

        Map<Integer, BigDecimal> yearTotals = new HashMap<>();
        BigDecimal grandTotal = BigDecimal.ZERO;
        for (CubeCell cell : reported) {
            yearTotals.merge(year(byQuarter, cell), cell.totalSalesUsd(), BigDecimal::add);
            grandTotal = grandTotal.add(cell.totalSalesUsd());
        }
        BigDecimal mean = reported.isEmpty()
                ? BigDecimal.ZERO
                : grandTotal.divide(BigDecimal.valueOf(reported.size()), 2, RoundingMode.HALF_UP);

        BigDecimal ratio = thresholdPercent.divide(HUNDRED);
        BigDecimal peakAbove = mean.multiply(BigDecimal.ONE.add(ratio));
        BigDecimal lowBelow = mean.multiply(BigDecimal.ONE.subtract(ratio));

        List<QuarterStaffing> quarters = new ArrayList<>(reported.size());
        for (CubeCell cell : reported) {
            int year = year(byQuarter, cell);
            int quarter = quarter(byQuarter, cell);
            BigDecimal total = cell.totalSalesUsd();

            StaffingLevel level = StaffingLevel.NORMAL;
            if (total.compareTo(peakAbove) > 0) {
                level = StaffingLevel.PEAK;
            } else if (total.compareTo(lowBelow) < 0) {
                level = StaffingLevel.LOW;
            }

            quarters.add(new QuarterStaffing(year, quarter, total, cell.transactionCount(),
                    share(total, yearTotals.get(year)), isComplete(year, quarter, lastSaleDate), level));
        }

        log.debug("Staffing report over {} quarters, mean {} USD", quarters.size(), mean);
        return new StaffingReport(lastSaleDate, thresholdPercent, mean, quarters, excluded);
    }

    static boolean isComplete(int year, int quarter, LocalDate lastSaleDate) {
        if (lastSaleDate == null) {
            return false;
        }
        LocalDate lastDay = LocalDate.of(year, quarter * 3, 1).with(TemporalAdjusters.lastDayOfMonth());
        return !lastSaleDate.isBefore(lastDay);
    }

    private static BigDecimal share(BigDecimal total, BigDecimal yearTotal) {
        if (yearTotal == null || yearTotal.signum() == 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return total.multiply(HUNDRED).divide(yearTotal, 1, RoundingMode.HALF_UP);
    }

    private static int year(Cube cube, CubeCell cell) {
        return (Integer) cube.value(cell, CubeDimension.YEAR);
    }

    private static int quarter(Cube cube, CubeCell cell) {
        return (Integer) cube.value(cell, CubeDimension.QUARTER);
    }
}
