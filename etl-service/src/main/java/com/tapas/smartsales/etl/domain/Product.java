package com.tapas.smartsales.etl.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Getter
@Setter
@Entity
@Table(name = "product")
public class Product {
    @Id
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    private String category;

    @Column(name = "unit_price_usd", nullable = false)
    private BigDecimal unitPriceUsd;

    private Integer stock;

    private String supplier;
}
