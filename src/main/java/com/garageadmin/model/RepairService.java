package com.garageadmin.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * A repair-job type offered by the garage (oil change, brake repair, ...).
 * Stored in the {@code services} table.
 */
@Entity
@Table(name = "services")
@Getter
@Setter
public class RepairService {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String category;

    // null = unassigned
    @Column(name = "worker_id")
    private Long workerId;
}
