package com.garageadmin.repository;

import com.garageadmin.model.InvoiceItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface InvoiceItemRepository extends JpaRepository<InvoiceItem, Long> {

    // insertion order is the display order
    List<InvoiceItem> findByInvoiceIdOrderByIdAsc(Long invoiceId);

    long countByInvoiceId(Long invoiceId);

    @Modifying(flushAutomatically = true)
    @Query("delete from InvoiceItem it where it.invoiceId = :invoiceId")
    int deleteByInvoice(@Param("invoiceId") Long invoiceId);

    @Modifying(flushAutomatically = true)
    @Query("delete from InvoiceItem it where it.invoiceId in " +
            "(select i.id from Invoice i where i.vehicleId = :vehicleId)")
    int deleteByVehicle(@Param("vehicleId") Long vehicleId);
}
