package com.garageadmin.service;

import com.garageadmin.config.GarageProperties;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The one place invoice totals are computed. Invoice creation stores what
 * this returns and the PDF renderer recomputes tax/total with it, so both
 * always agree.
 */
@Component
public class InvoiceCalculator {

    private final BigDecimal taxRate;

    @Autowired
    public InvoiceCalculator(GarageProperties properties) {
        this(properties.getInvoice().getTaxRate());
    }

    InvoiceCalculator(BigDecimal taxRate) {
        this.taxRate = taxRate;
    }

    /**
     * @param itemsTotal sum of the line totals
     * @param days       days in garage, never negative
     * @param rate       garage stay rate per day
     */
    public InvoiceTotals totals(BigDecimal itemsTotal, int days, BigDecimal rate) {
        BigDecimal garageStay = garageStay(days, rate);
        BigDecimal subtotal = itemsTotal.add(garageStay);
        BigDecimal tax = taxOn(subtotal);
        return new InvoiceTotals(garageStay, subtotal, tax, subtotal.add(tax));
    }

    public BigDecimal garageStay(int days, BigDecimal rate) {
        return rate.multiply(BigDecimal.valueOf(days));
    }

    /** Tax in whole RWF, half-up. */
    public BigDecimal taxOn(BigDecimal subtotal) {
        return subtotal.multiply(taxRate).setScale(0, RoundingMode.HALF_UP);
    }

    public BigDecimal lineTotal(BigDecimal unitPrice, int quantity) {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    /** "18%" for a rate of 0.18. */
    public String taxLabel() {
        return taxRate.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
    }

    @Value
    public static class InvoiceTotals {
        BigDecimal garageStay;
        BigDecimal subtotal;
        BigDecimal tax;
        BigDecimal total;
    }
}
