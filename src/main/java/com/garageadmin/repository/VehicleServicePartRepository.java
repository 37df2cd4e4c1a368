package com.garageadmin.repository;

import com.garageadmin.model.VehicleServicePart;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface VehicleServicePartRepository extends JpaRepository<VehicleServicePart, Long> {

    List<VehicleServicePart> findByVehicleIdOrderByIdAsc(Long vehicleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from VehicleServicePart p where p.vehicleId = :vehicleId")
    int deleteByVehicle(@Param("vehicleId") Long vehicleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from VehicleServicePart p where p.serviceId = :serviceId")
    int deleteByService(@Param("serviceId") Long serviceId);
}
