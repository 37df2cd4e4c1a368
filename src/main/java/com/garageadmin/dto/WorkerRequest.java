package com.garageadmin.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class WorkerRequest {

    @NotBlank(message = "Name is required")
    private String name;

    private String jobTitle;
    private String phone;
    private String email;
}
