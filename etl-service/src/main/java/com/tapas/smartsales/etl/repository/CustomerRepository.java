package com.tapas.smartsales.etl.repository;

import com.tapas.smartsales.etl.domain.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CustomerRepository extends JpaRepository<Customer, Long> {
}
