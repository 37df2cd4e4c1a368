package com.garageadmin.service;

import com.garageadmin.config.GarageProperties;
import com.garageadmin.dto.InvoiceDetailDto;
import com.garageadmin.dto.InvoiceRequest;
import com.garageadmin.dto.InvoiceRowDto;
import com.garageadmin.exception.NotFoundException;
import com.garageadmin.model.Invoice;
import com.garageadmin.model.InvoiceItem;
import com.garageadmin.model.Part;
import com.garageadmin.repository.InvoiceItemRepository;
import com.garageadmin.repository.InvoiceRepository;
import com.garageadmin.repository.PartRepository;
import com.garageadmin.repository.VehicleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
@Slf4j
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final InvoiceItemRepository invoiceItemRepository;
    private final PartRepository partRepository;
    private final VehicleRepository vehicleRepository;
    private final InvoiceCalculator calculator;
    private final GarageProperties properties;
    private final Clock clock;

    public InvoiceService(InvoiceRepository invoiceRepository,
                          InvoiceItemRepository invoiceItemRepository,
                          PartRepository partRepository,
                          VehicleRepository vehicleRepository,
                          InvoiceCalculator calculator,
                          GarageProperties properties,
                          Clock clock) {
        this.invoiceRepository = invoiceRepository;
        this.invoiceItemRepository = invoiceItemRepository;
        this.partRepository = partRepository;
        this.vehicleRepository = vehicleRepository;
        this.calculator = calculator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Persists an invoice and its items and writes the computed totals back.
     * Part prices come from inventory; a missing vehicle or part aborts the
     * whole invoice.
     *
     * @return the new invoice id
     */
    @Transactional(rollbackFor = Exception.class)
    public Long create(InvoiceRequest request) {
        if (!vehicleRepository.existsById(request.getVehicleId())) {
            throw new NotFoundException("Vehicle not found");
        }

        Invoice invoice = new Invoice();
        invoice.setVehicleId(request.getVehicleId());
        invoice.setDaysInGarage(request.getDaysInGarage());
        invoice.setGarageStayRate(properties.getInvoice().getStayRate());
        invoice.setCreatedAt(LocalDateTime.now(clock));
        invoice = invoiceRepository.save(invoice);

        BigDecimal itemsTotal = BigDecimal.ZERO;

        for (InvoiceRequest.ServiceLine line : orEmpty(request.getServices())) {
            BigDecimal price = line.getUnitPrice() != null ? line.getUnitPrice() : BigDecimal.ZERO;

            InvoiceItem item = new InvoiceItem();
            item.setInvoiceId(invoice.getId());
            item.setItemType(InvoiceItem.TYPE_SERVICE);
            item.setItemId(line.getId());
            item.setDescription(line.getDescription());
            item.setQuantity(1);
            item.setUnitPrice(price);
            item.setTotal(price);
            invoiceItemRepository.save(item);

            itemsTotal = itemsTotal.add(price);
        }

        for (InvoiceRequest.PartLine line : orEmpty(request.getParts())) {
            Part part = partRepository.findById(line.getId())
                    .orElseThrow(() -> new NotFoundException("Part not found: " + line.getId()));

            BigDecimal lineTotal = calculator.lineTotal(part.getSellingCost(), line.getQuantity());

            InvoiceItem item = new InvoiceItem();
            item.setInvoiceId(invoice.getId());
            item.setItemType(InvoiceItem.TYPE_PART);
            item.setItemId(part.getId());
            item.setDescription(line.getDescription() != null && !line.getDescription().isBlank()
                    ? line.getDescription() : part.getName());
            item.setQuantity(line.getQuantity());
            item.setPurchasedCost(part.getPurchasingCost());
            item.setUnitPrice(part.getSellingCost());
            item.setTotal(lineTotal);
            invoiceItemRepository.save(item);

            itemsTotal = itemsTotal.add(lineTotal);
        }

        InvoiceCalculator.InvoiceTotals totals =
                calculator.totals(itemsTotal, invoice.getDaysInGarage(), invoice.getGarageStayRate());
        invoice.setSubtotal(totals.getSubtotal());
        invoice.setTax(totals.getTax());
        invoice.setTotal(totals.getTotal());
        invoiceRepository.save(invoice);

        log.info("Invoice {} created for vehicle {}: subtotal={} tax={} total={}",
                invoice.getId(), invoice.getVehicleId(),
                totals.getSubtotal(), totals.getTax(), totals.getTotal());
        return invoice.getId();
    }

    @Transactional(readOnly = true)
    public List<InvoiceRowDto> list() {
        return invoiceRepository.findAllRows();
    }

    @Transactional(readOnly = true)
    public InvoiceDetailDto get(Long id) {
        InvoiceRowDto row = invoiceRepository.findRowById(id)
                .orElseThrow(() -> new NotFoundException("Invoice not found"));
        return new InvoiceDetailDto(row, invoiceItemRepository.findByInvoiceIdOrderByIdAsc(id));
    }

    @Transactional(rollbackFor = Exception.class)
    public void delete(Long id) {
        invoiceItemRepository.deleteByInvoice(id);
        if (invoiceRepository.deleteInvoice(id) == 0) {
            throw new NotFoundException("Invoice not found");
        }
        log.info("Invoice {} deleted", id);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
