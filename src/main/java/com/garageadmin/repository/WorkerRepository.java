package com.garageadmin.repository;

import com.garageadmin.model.Worker;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface WorkerRepository extends JpaRepository<Worker, Long> {
    List<Worker> findAllByOrderByNameAsc();

    // Returns affected rows so callers can tell "deleted" from "never existed"
    @Modifying(flushAutomatically = true)
    @Query("delete from Worker w where w.id = :id")
    int deleteWorker(@Param("id") Long id);
}
