package com.tapas.smartsales.olap.cube;

/**
 * A cube was requested over something the fact schema does not define.
 * No partial cube is produced.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message) {
        super(message);
    }
}
