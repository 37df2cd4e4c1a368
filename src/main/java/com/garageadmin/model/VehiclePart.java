package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/** A part used on a vehicle without being tied to a service. */
@Entity
@Table(name = "vehicle_parts")
@Getter
@Setter
public class VehiclePart {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vehicle_id", nullable = false)
    private Long vehicleId;

    @Column(name = "part_id", nullable = false)
    private Long partId;

    @Column(nullable = false)
    private Integer quantity;
}
