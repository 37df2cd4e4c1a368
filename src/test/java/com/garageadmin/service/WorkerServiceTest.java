package com.garageadmin.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerServiceTest {

    private static final ZoneId KIGALI = ZoneId.of("Africa/Kigali");

    @Test
    void paymentDate_acceptsPlainDate() {
        assertThat(WorkerService.parsePaymentDate("2025-01-15", KIGALI))
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 0, 0));
    }

    @Test
    void paymentDate_acceptsLocalAndOffsetDateTimes() {
        assertThat(WorkerService.parsePaymentDate("2025-01-15T08:30", KIGALI))
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 8, 30));
        assertThat(WorkerService.parsePaymentDate(" 2025-01-15T08:30:10+02:00 ", KIGALI))
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 8, 30, 10));
    }

    @Test
    void paymentDate_offsetIsMovedToTheGarageZone() {
        assertThat(WorkerService.parsePaymentDate("2025-01-15T10:00:00Z", KIGALI))
                .isEqualTo(LocalDateTime.of(2025, 1, 15, 12, 0));
        assertThat(WorkerService.parsePaymentDate("2025-01-15T23:30:00-05:00", KIGALI))
                .isEqualTo(LocalDateTime.of(2025, 1, 16, 6, 30));
    }

    @Test
    void paymentDate_blankOrGarbage_isNull() {
        assertThat(WorkerService.parsePaymentDate(null, KIGALI)).isNull();
        assertThat(WorkerService.parsePaymentDate("  ", KIGALI)).isNull();
        assertThat(WorkerService.parsePaymentDate("yesterday", KIGALI)).isNull();
        assertThat(WorkerService.parsePaymentDate("2025-13-40", KIGALI)).isNull();
    }
}
