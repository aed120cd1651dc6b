package com.tapas.smartsales.etl.repository;

import java.time.LocalDate;

public interface SaleDateRange {
    LocalDate getFirstSaleDate();
    LocalDate getLastSaleDate();
}
