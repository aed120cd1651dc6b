package com.tapas.smartsales.etl.repository;

import com.tapas.smartsales.etl.domain.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ProductRepository extends JpaRepository<Product, Long> {

    @Query("select distinct p.category from Product p where p.category is not null order by p.category")
    List<String> findCategories();
}
