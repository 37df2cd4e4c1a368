package com.garageadmin.repository;

import com.garageadmin.dto.ServiceRowDto;
import com.garageadmin.model.RepairService;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RepairServiceRepository extends JpaRepository<RepairService, Long> {

    @Query("select new com.garageadmin.dto.ServiceRowDto(s.id, s.name, s.category, s.workerId, w.name) " +
            "from RepairService s left join Worker w on w.id = s.workerId " +
            "order by s.name")
    List<ServiceRowDto> findAllRows();

    @Query("select new com.garageadmin.dto.ServiceRowDto(s.id, s.name, s.category, s.workerId, w.name) " +
            "from RepairService s left join Worker w on w.id = s.workerId " +
            "where s.id = :id")
    Optional<ServiceRowDto> findRowById(@Param("id") Long id);

    @Modifying(flushAutomatically = true)
    @Query("update RepairService s set s.workerId = null where s.workerId = :workerId")
    int unassignWorker(@Param("workerId") Long workerId);

    @Modifying(flushAutomatically = true)
    @Query("delete from RepairService s where s.id = :id")
    int deleteService(@Param("id") Long id);
}
