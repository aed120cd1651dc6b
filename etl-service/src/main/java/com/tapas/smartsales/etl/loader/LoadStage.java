package com.tapas.smartsales.etl.loader;

public enum LoadStage {
    CUSTOMERS,
    PRODUCTS,
    SALES
}
