package com.tapas.smartsales.etl.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(name = "sale")
public class Sale {
    @Id
    @Column(name = "sale_id")
    private Long saleId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "sale_date", nullable = false)
    private LocalDate saleDate;

    @Column(name = "sale_amount_usd", nullable = false)
    private BigDecimal saleAmountUsd;

    @Column(nullable = false)
    private Integer quantity;

    @Column(name = "store_id")
    private Long storeId;

    @Column(name = "campaign_id")
    private Long campaignId;

    @Column(name = "discount_percent")
    private BigDecimal discountPercent;

    @Column(name = "payment_type")
    private String paymentType; // CREDIT | DEBIT | CASH | ...
}
