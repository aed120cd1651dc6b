package com.tapas.smartsales.olap.cube;

import com.tapas.smartsales.olap.fact.SaleFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Group-by-and-reduce over sale facts. Only combinations that occur produce a
 * cell, and cells come out sorted by key so the result does not depend on the
 * order of the input.
 */
@Component
public class CubeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CubeBuilder.class);

    public Cube build(CubeDefinition definition, Collection<SaleFact> facts) {
        var aggregates = new HashMap<List<Object>, Aggregation>();
        for (SaleFact fact : facts) {
            List<Object> key = new ArrayList<>(definition.dimensions().size());
            for (CubeDimension dimension : definition.dimensions()) {
                key.add(dimension.valueOf(fact));
            }
            aggregates.computeIfAbsent(key, k -> new Aggregation()).add(fact);
        }

        List<CubeCell> cells = aggregates.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(keyOrder(definition.dimensions())))
                .map(entry -> entry.getValue().toCell(entry.getKey()))
                .toList();

        logger.debug("Built cube {} with {} cells from {} facts", definition.name(), cells.size(), facts.size());
        return new Cube(definition, cells);
    }

    // dimension by dimension, nulls after every value
    private static Comparator<List<Object>> keyOrder(List<CubeDimension> dimensions) {
        Comparator<List<Object>> order = (left, right) -> 0;
        for (int i = 0; i < dimensions.size(); i++) {
            int position = i;
            order = order.thenComparing(key -> key.get(position), dimensions.get(i).valueOrder());
        }
        return order;
    }

    private static class Aggregation {
        BigDecimal totalAmount = BigDecimal.ZERO;
        long totalQuantity = 0;
        long transactionCount = 0;
        final List<Long> saleIds = new ArrayList<>();

        void add(SaleFact fact) {
            totalAmount = totalAmount.add(fact.saleAmountUsd());
            totalQuantity += fact.quantity();
            transactionCount++;
            saleIds.add(fact.saleId());
        }

        CubeCell toCell(List<Object> key) {
            saleIds.sort(Comparator.naturalOrder());
            BigDecimal average = totalAmount.divide(BigDecimal.valueOf(transactionCount), 2, RoundingMode.HALF_UP);
            return new CubeCell(key, totalAmount, transactionCount, totalQuantity, average, saleIds);
        }
    }
}
