package com.garageadmin.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@AllArgsConstructor
public class VehicleServiceDto {
    private Long id;                // services.id
    private String name;
    private String status;
    private LocalDateTime completedTime;
    private Long workerId;
    private String workerName;

    // only filled on the single-vehicle view
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private List<VehiclePartDto> parts;
}
