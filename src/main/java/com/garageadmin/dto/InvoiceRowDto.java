package com.garageadmin.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Invoice columns joined with the vehicle's plate and owner.
 * Built directly by a JPQL constructor expression, so the constructor
 * argument order must follow the field order.
 */
@Getter
@AllArgsConstructor
public class InvoiceRowDto {
    private Long id;
    private Long vehicleId;
    private Integer daysInGarage;
    private BigDecimal garageStayRate;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal total;
    private LocalDateTime createdAt;
    private String plate;
    private String owner;
}
