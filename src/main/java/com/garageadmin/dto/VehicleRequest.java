package com.garageadmin.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST/PUT /api/vehicles.
 * {@code serviceIds} is only read on create; the two part lists fully
 * replace what the vehicle had on update.
 */
@Data
public class VehicleRequest {

    @NotBlank(message = "Plate, owner, and contact number are required")
    private String plate;

    private String make;
    private String modelName;
    private Integer year;
    private String vin;

    @NotBlank(message = "Plate, owner, and contact number are required")
    private String owner;

    @NotBlank(message = "Plate, owner, and contact number are required")
    private String contactNumber;

    private List<@NotNull(message = "service_ids must not contain null") Long> serviceIds = new ArrayList<>();

    private List<@Valid @NotNull(message = "standalone_parts must not contain null") PartQuantity> standaloneParts = new ArrayList<>();

    private List<@Valid @NotNull(message = "service_parts must not contain null") ServicePartQuantity> serviceParts = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartQuantity {
        @NotNull(message = "part_id is required")
        private Long partId;

        @NotNull(message = "quantity is required")
        @Positive(message = "quantity must be positive")
        private Integer quantity;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServicePartQuantity {
        @NotNull(message = "service_id is required")
        private Long serviceId;

        @NotNull(message = "part_id is required")
        private Long partId;

        @NotNull(message = "quantity is required")
        @Positive(message = "quantity must be positive")
        private Integer quantity;
    }
}
