package com.garageadmin.repository;

import com.garageadmin.dto.InvoiceRowDto;
import com.garageadmin.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    long countByVehicleId(Long vehicleId);

    Optional<Invoice> findFirstByVehicleIdOrderByIdDesc(Long vehicleId);

    @Query("select new com.garageadmin.dto.InvoiceRowDto(i.id, i.vehicleId, i.daysInGarage, i.garageStayRate, " +
            "i.subtotal, i.tax, i.total, i.createdAt, v.plate, v.owner) " +
            "from Invoice i left join Vehicle v on v.id = i.vehicleId " +
            "order by i.id desc")
    List<InvoiceRowDto> findAllRows();

    @Query("select new com.garageadmin.dto.InvoiceRowDto(i.id, i.vehicleId, i.daysInGarage, i.garageStayRate, " +
            "i.subtotal, i.tax, i.total, i.createdAt, v.plate, v.owner) " +
            "from Invoice i left join Vehicle v on v.id = i.vehicleId " +
            "where i.id = :id")
    Optional<InvoiceRowDto> findRowById(@Param("id") Long id);

    @Modifying(flushAutomatically = true)
    @Query("delete from Invoice i where i.vehicleId = :vehicleId")
    int deleteByVehicle(@Param("vehicleId") Long vehicleId);

    @Modifying(flushAutomatically = true)
    @Query("delete from Invoice i where i.id = :id")
    int deleteInvoice(@Param("id") Long id);
}
