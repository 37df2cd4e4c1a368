package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "worker_payments")
@Getter
@Setter
public class WorkerPayment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "worker_id", nullable = false)
    private Long workerId;

    @Column(nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    private String method;

    private String notes;

    // always set by the service; the default covers rows written outside the app
    @ColumnDefault("CURRENT_TIMESTAMP")
    @Column(name = "payment_date")
    private LocalDateTime paymentDate;
}
