package com.garageadmin.repository;

import com.garageadmin.model.Part;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PartRepository extends JpaRepository<Part, Long> {
    List<Part> findAllByOrderByNameAsc();
}
