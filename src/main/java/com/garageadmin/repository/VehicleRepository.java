package com.garageadmin.repository;

import com.garageadmin.dto.VehicleIdDto;
import com.garageadmin.model.Vehicle;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    List<Vehicle> findAllByOrderByEntryTimeDesc();

    @Query("select new com.garageadmin.dto.VehicleIdDto(v.id, v.plate, v.owner) from Vehicle v order by v.id desc")
    List<VehicleIdDto> findAllIds();

    @Modifying(flushAutomatically = true)
    @Query("delete from Vehicle v where v.id = :id")
    int deleteVehicle(@Param("id") Long id);
}
