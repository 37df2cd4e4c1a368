package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/** One service scheduled on one vehicle ({@code vehicle_services}). */
@Entity
@Table(name = "vehicle_services")
@Getter
@Setter
public class VehicleServiceEntry {

    public static final String PENDING = "pending";
    public static final String COMPLETED = "completed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(nullable = false)
    private String status = PENDING;

    @Column(name = "completed_time")
    private LocalDateTime completedTime;
}
