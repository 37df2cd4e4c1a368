package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;

@Entity
@Table(name = "parts")
@Getter
@Setter
public class Part {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "part_number", nullable = false)
    private String partNumber;

    @Column(name = "purchasing_cost", nullable = false, precision = 14, scale = 2)
    private BigDecimal purchasingCost;

    @Column(name = "selling_cost", nullable = false, precision = 14, scale = 2)
    private BigDecimal sellingCost;

    @Column(name = "quantity_in_stock", nullable = false)
    private Integer quantityInStock = 0;
}
