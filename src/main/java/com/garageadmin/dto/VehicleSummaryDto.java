package com.garageadmin.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.garageadmin.model.Vehicle;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/** Row of GET /api/vehicles: the vehicle columns plus its services. */
@Getter
@AllArgsConstructor
public class VehicleSummaryDto {

    @JsonUnwrapped
    private Vehicle vehicle;

    private List<VehicleServiceDto> services;
}
