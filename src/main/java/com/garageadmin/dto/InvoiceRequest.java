package com.garageadmin.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /api/invoices. Only selections travel from the client:
 * part prices are read from inventory and every total is computed here.
 */
@Data
public class InvoiceRequest {

    @NotNull(message = "Vehicle ID and days in garage are required.")
    private Long vehicleId;

    @NotNull(message = "Vehicle ID and days in garage are required.")
    @PositiveOrZero(message = "days_in_garage must not be negative")
    private Integer daysInGarage;

    private List<@Valid @NotNull(message = "services must not contain null") ServiceLine> services = new ArrayList<>();

    private List<@Valid @NotNull(message = "parts must not contain null") PartLine> parts = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ServiceLine {
        @NotNull(message = "service id is required")
        private Long id;

        private String description;

        // the agreed price for the job; billed as a single unit
        @PositiveOrZero(message = "unit_price must not be negative")
        private BigDecimal unitPrice;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartLine {
        @NotNull(message = "part id is required")
        private Long id;

        private String description;

        @NotNull(message = "part quantity is required")
        @Positive(message = "part quantity must be positive")
        private Integer quantity;
    }
}
