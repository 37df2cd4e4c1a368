package com.garageadmin.dto;

import com.garageadmin.model.InvoiceItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class InvoiceDetailDto {
    private InvoiceRowDto invoice;
    private List<InvoiceItem> items;
}
