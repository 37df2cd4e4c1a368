package com.garageadmin.dto;

import com.garageadmin.model.Worker;
import com.garageadmin.model.WorkerPayment;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

@Getter
@AllArgsConstructor
public class WorkerPaymentsDto {
    private Worker worker;
    private List<WorkerPayment> payments;   // newest first
    private BigDecimal total;
}
