package com.garageadmin.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class InvoiceCalculatorTest {

    private final InvoiceCalculator calculator = new InvoiceCalculator(new BigDecimal("0.18"));

    @Test
    void workedExample_twoDaysWithServiceAndParts() {
        // service 3000 + 2 parts at 1000, 2 days at 5000
        BigDecimal items = new BigDecimal("3000").add(calculator.lineTotal(new BigDecimal("1000"), 2));

        InvoiceCalculator.InvoiceTotals t = calculator.totals(items, 2, new BigDecimal("5000"));

        assertThat(t.getGarageStay()).isEqualByComparingTo("10000");
        assertThat(t.getSubtotal()).isEqualByComparingTo("15000");
        assertThat(t.getTax()).isEqualByComparingTo("2700");
        assertThat(t.getTotal()).isEqualByComparingTo("17700");
    }

    @Test
    void garageStay_isDaysTimesRate_andMatchesTotals() {
        assertThat(calculator.garageStay(0, new BigDecimal("5000"))).isEqualByComparingTo("0");
        assertThat(calculator.garageStay(3, new BigDecimal("5000"))).isEqualByComparingTo("15000");
        assertThat(calculator.totals(BigDecimal.ZERO, 3, new BigDecimal("5000")).getGarageStay())
                .isEqualByComparingTo(calculator.garageStay(3, new BigDecimal("5000")));
    }

    @Test
    void taxRoundsHalfUpToWholeFrancs() {
        // 25 * 0.18 = 4.5 -> 5
        assertThat(calculator.taxOn(new BigDecimal("25"))).isEqualByComparingTo("5");
        // 2.5 * 0.18 = 0.45 -> 0
        assertThat(calculator.taxOn(new BigDecimal("2.5"))).isEqualByComparingTo("0");
        // 1234.56 * 0.18 = 222.2208 -> 222
        assertThat(calculator.taxOn(new BigDecimal("1234.56"))).isEqualByComparingTo("222");
        assertThat(calculator.taxOn(new BigDecimal("1234.56")).scale()).isZero();
    }

    @Test
    void totalIsAlwaysSubtotalPlusTax() {
        for (int days = 0; days < 5; days++) {
            BigDecimal items = new BigDecimal("1333.33").multiply(BigDecimal.valueOf(days + 1));
            InvoiceCalculator.InvoiceTotals t = calculator.totals(items, days, new BigDecimal("5000"));

            assertThat(t.getSubtotal()).isEqualByComparingTo(items.add(new BigDecimal(5000L * days)));
            assertThat(t.getTax()).isEqualByComparingTo(calculator.taxOn(t.getSubtotal()));
            assertThat(t.getTotal()).isEqualByComparingTo(t.getSubtotal().add(t.getTax()));
        }
    }

    @Test
    void zeroDaysAndNoItems_isAllZero() {
        InvoiceCalculator.InvoiceTotals t = calculator.totals(BigDecimal.ZERO, 0, new BigDecimal("5000"));

        assertThat(t.getGarageStay()).isEqualByComparingTo("0");
        assertThat(t.getTotal()).isEqualByComparingTo("0");
    }

    @Test
    void taxLabel_isPercentage() {
        assertThat(calculator.taxLabel()).isEqualTo("18%");
        assertThat(new InvoiceCalculator(new BigDecimal("0.075")).taxLabel()).isEqualTo("7.5%");
    }
}
