package com.garageadmin.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.garageadmin.model.Invoice;
import com.garageadmin.model.Vehicle;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * GET /api/vehicles/{id}: services with their parts, standalone parts,
 * and the most recent invoice (null until one is generated).
 */
@Getter
@AllArgsConstructor
public class VehicleDetailDto {

    @JsonUnwrapped
    private Vehicle vehicle;

    private List<VehicleServiceDto> services;

    private List<VehiclePartDto> standaloneParts;

    private Invoice invoice;
}
