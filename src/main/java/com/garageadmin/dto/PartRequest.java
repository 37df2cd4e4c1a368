package com.garageadmin.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class PartRequest {

    @NotBlank(message = "name is required")
    private String name;

    @NotBlank(message = "part_number is required")
    private String partNumber;

    @NotNull(message = "purchasing_cost is required")
    @PositiveOrZero(message = "purchasing_cost must not be negative")
    private BigDecimal purchasingCost;

    @NotNull(message = "selling_cost is required")
    @PositiveOrZero(message = "selling_cost must not be negative")
    private BigDecimal sellingCost;

    @PositiveOrZero(message = "quantity_in_stock must not be negative")
    private Integer quantityInStock;
}
