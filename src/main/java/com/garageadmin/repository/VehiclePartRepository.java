package com.garageadmin.repository;

import com.garageadmin.model.VehiclePart;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface VehiclePartRepository extends JpaRepository<VehiclePart, Long> {

    List<VehiclePart> findByVehicleIdOrderByIdAsc(Long vehicleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from VehiclePart p where p.vehicleId = :vehicleId")
    int deleteByVehicle(@Param("vehicleId") Long vehicleId);
}
