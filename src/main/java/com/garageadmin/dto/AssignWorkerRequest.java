package com.garageadmin.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class AssignWorkerRequest {

    @NotNull(message = "worker_id is required")
    private Long workerId;
}
