package com.tapas.smartsales.etl.repository;

import com.tapas.smartsales.etl.domain.Sale;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface SaleRepository extends JpaRepository<Sale, Long> {

    @Query("select min(s.saleDate) as firstSaleDate, max(s.saleDate) as lastSaleDate from Sale s")
    SaleDateRange findSaleDateRange();

}
