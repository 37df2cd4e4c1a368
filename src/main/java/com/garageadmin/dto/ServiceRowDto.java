package com.garageadmin.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A catalog service plus the name of the worker it is assigned to. */
@Getter
@AllArgsConstructor
public class ServiceRowDto {
    private Long id;
    private String name;
    private String category;
    private Long workerId;
    private String workerName;
}
