package com.garageadmin.repository;

import com.garageadmin.model.WorkerPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;

public interface WorkerPaymentRepository extends JpaRepository<WorkerPayment, Long> {

    @Query("select p from WorkerPayment p where p.workerId = :workerId " +
            "order by p.paymentDate desc nulls last, p.id desc")
    List<WorkerPayment> findHistory(@Param("workerId") Long workerId);

    @Query("select coalesce(sum(p.amount), 0) from WorkerPayment p where p.workerId = :workerId")
    BigDecimal sumAmountByWorkerId(@Param("workerId") Long workerId);

    long countByWorkerId(Long workerId);

    @Modifying(flushAutomatically = true)
    @Query("delete from WorkerPayment p where p.workerId = :workerId")
    int deleteByWorker(@Param("workerId") Long workerId);
}
