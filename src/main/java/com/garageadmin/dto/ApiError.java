package com.garageadmin.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** Body of every non-2xx JSON answer: {@code {"error": "..."}}. */
@Getter
@AllArgsConstructor
public class ApiError {
    private String error;
}
