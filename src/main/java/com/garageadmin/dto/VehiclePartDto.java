package com.garageadmin.dto;

import com.garageadmin.model.Part;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;

/** A part as used on a vehicle: catalog data plus the quantity consumed. */
@Getter
@AllArgsConstructor
public class VehiclePartDto {
    private Long id;
    private String name;
    private String partNumber;
    private Integer quantity;
    private BigDecimal purchasingCost;
    private BigDecimal sellingCost;
    private Integer quantityInStock;

    public static VehiclePartDto of(Part part, Integer quantity) {
        return new VehiclePartDto(
                part.getId(),
                part.getName(),
                part.getPartNumber(),
                quantity,
                part.getPurchasingCost(),
                part.getSellingCost(),
                part.getQuantityInStock()
        );
    }
}
