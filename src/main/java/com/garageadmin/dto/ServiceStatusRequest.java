package com.garageadmin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class ServiceStatusRequest {

    @NotBlank(message = "status is required")
    private String status;          // "pending" | "completed" | ...

    private LocalDateTime completedTime;
}
