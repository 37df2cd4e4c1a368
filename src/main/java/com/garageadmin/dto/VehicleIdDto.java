package com.garageadmin.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class VehicleIdDto {
    private Long id;
    private String plate;
    private String owner;
}
