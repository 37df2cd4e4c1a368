package com.garageadmin.pdf;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class MoneyFormatTest {

    @Test
    void rwf_hasNoMinorUnitAndUsGrouping() {
        assertThat(MoneyFormat.rwf(new BigDecimal("15000.00"))).isEqualTo("RWF 15,000");
        assertThat(MoneyFormat.rwf(new BigDecimal("1234567.5"))).isEqualTo("RWF 1,234,568");
        assertThat(MoneyFormat.rwf(null)).isEqualTo("RWF 0");
    }

    @Test
    void amount_keepsTwoDecimals() {
        assertThat(MoneyFormat.amount(new BigDecimal("3000.5"))).isEqualTo("3,000.50");
        assertThat(MoneyFormat.amount(new BigDecimal("12"))).isEqualTo("12.00");
    }

    @Test
    void dateTime_missingIsDash() {
        assertThat(MoneyFormat.dateTime(null)).isEqualTo("-");
        assertThat(MoneyFormat.dateTime(LocalDateTime.of(2025, 2, 3, 9, 5, 59))).isEqualTo("2025-02-03 09:05");
    }
}
