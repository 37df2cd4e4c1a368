package com.garageadmin.repository;

import com.garageadmin.model.VehicleServiceEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface VehicleServiceEntryRepository extends JpaRepository<VehicleServiceEntry, Long> {

    List<VehicleServiceEntry> findByVehicleIdOrderByIdAsc(Long vehicleId);

    Optional<VehicleServiceEntry> findFirstByVehicleIdAndServiceId(Long vehicleId, Long serviceId);

    // exit precondition: anything not yet "completed"
    long countByVehicleIdAndStatusNot(Long vehicleId, String status);

    @Modifying(flushAutomatically = true)
    @Query("delete from VehicleServiceEntry e where e.vehicleId = :vehicleId")
    int deleteByVehicle(@Param("vehicleId") Long vehicleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from VehicleServiceEntry e where e.serviceId = :serviceId")
    int deleteByService(@Param("serviceId") Long serviceId);
}
