package com.garageadmin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ServiceRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String category;

    private Long workerId; // optional
}
