package com.garageadmin.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class PaymentRequest {

    @NotNull(message = "Invalid amount")
    @Positive(message = "Invalid amount")
    private BigDecimal amount;

    private String method;

    private String notes;

    // YYYY-MM-DD or ISO date-time; anything else is stamped with the current time
    private String paymentDate;
}
