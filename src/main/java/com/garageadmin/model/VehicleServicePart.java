package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/** A part consumed while performing a specific service on a vehicle. */
@Entity
@Table(name = "vehicle_service_parts")
@Getter
@Setter
public class VehicleServicePart {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "part_id", nullable = false)
    private Long partId;

    @Column(nullable = false)
    private Integer quantity;
}
