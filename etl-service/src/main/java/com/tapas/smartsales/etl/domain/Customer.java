package com.tapas.smartsales.etl.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(name = "customer")
public class Customer {
    @Id
    @Column(name = "customer_id")
    private Long customerId;

    @Column(nullable = false)
    private String name;

    private String region;

    @Column(name = "join_date")
    private LocalDate joinDate;

    private Integer age;

    @Column(name = "preferred_contact")
    private String preferredContact;
}
