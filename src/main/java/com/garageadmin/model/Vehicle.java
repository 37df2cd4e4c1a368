package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "vehicles")
@Getter
@Setter
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String plate;

    private String make;

    @Column(name = "model_name")
    private String modelName;

    private Integer year;

    private String vin;

    @Column(nullable = false)
    private String owner;

    @Column(name = "contact_number", nullable = false)
    private String contactNumber;

    @Column(name = "entry_time", nullable = false)
    private LocalDateTime entryTime;

    // set once, when the vehicle leaves the garage
    @Column(name = "exit_time")
    private LocalDateTime exitTime;
}
