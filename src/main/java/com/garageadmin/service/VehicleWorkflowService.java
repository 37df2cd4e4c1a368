package com.garageadmin.service;

import com.garageadmin.dto.VehicleDetailDto;
import com.garageadmin.dto.VehicleIdDto;
import com.garageadmin.dto.VehiclePartDto;
import com.garageadmin.dto.VehicleRequest;
import com.garageadmin.dto.VehicleServiceDto;
import com.garageadmin.dto.VehicleSummaryDto;
import com.garageadmin.exception.DomainPreconditionException;
import com.garageadmin.exception.NotFoundException;
import com.garageadmin.model.Part;
import com.garageadmin.model.RepairService;
import com.garageadmin.model.Vehicle;
import com.garageadmin.model.VehiclePart;
import com.garageadmin.model.VehicleServiceEntry;
import com.garageadmin.model.VehicleServicePart;
import com.garageadmin.model.Worker;
import com.garageadmin.repository.InvoiceItemRepository;
import com.garageadmin.repository.InvoiceRepository;
import com.garageadmin.repository.PartRepository;
import com.garageadmin.repository.RepairServiceRepository;
import com.garageadmin.repository.VehiclePartRepository;
import com.garageadmin.repository.VehicleRepository;
import com.garageadmin.repository.VehicleServiceEntryRepository;
import com.garageadmin.repository.VehicleServicePartRepository;
import com.garageadmin.repository.WorkerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Vehicles and their three join tables. Every mutation that touches more
 * than one table runs in a single transaction.
 */
@Service
@Slf4j
public class VehicleWorkflowService {

    static final String SERVICES_INCOMPLETE = "All services must be completed before exiting.";
    static final String INVOICE_MISSING = "Invoice must be generated before exiting.";
    static final String EXITED = "Vehicle exited successfully.";

    private final VehicleRepository vehicleRepository;
    private final VehicleServiceEntryRepository serviceEntryRepository;
    private final VehiclePartRepository vehiclePartRepository;
    private final VehicleServicePartRepository servicePartRepository;
    private final InvoiceRepository invoiceRepository;
    private final InvoiceItemRepository invoiceItemRepository;
    private final RepairServiceRepository repairServiceRepository;
    private final PartRepository partRepository;
    private final WorkerRepository workerRepository;
    private final Clock clock;

    public VehicleWorkflowService(VehicleRepository vehicleRepository,
                                  VehicleServiceEntryRepository serviceEntryRepository,
                                  VehiclePartRepository vehiclePartRepository,
                                  VehicleServicePartRepository servicePartRepository,
                                  InvoiceRepository invoiceRepository,
                                  InvoiceItemRepository invoiceItemRepository,
                                  RepairServiceRepository repairServiceRepository,
                                  PartRepository partRepository,
                                  WorkerRepository workerRepository,
                                  Clock clock) {
        this.vehicleRepository = vehicleRepository;
        this.serviceEntryRepository = serviceEntryRepository;
        this.vehiclePartRepository = vehiclePartRepository;
        this.servicePartRepository = servicePartRepository;
        this.invoiceRepository = invoiceRepository;
        this.invoiceItemRepository = invoiceItemRepository;
        this.repairServiceRepository = repairServiceRepository;
        this.partRepository = partRepository;
        this.workerRepository = workerRepository;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- reads

    @Transactional(readOnly = true)
    public List<VehicleSummaryDto> list() {
        Map<Long, RepairService> services = byId(repairServiceRepository.findAll(), RepairService::getId);
        Map<Long, Worker> workers = byId(workerRepository.findAll(), Worker::getId);

        return vehicleRepository.findAllByOrderByEntryTimeDesc().stream()
                .map(v -> new VehicleSummaryDto(v, serviceRows(v.getId(), services, workers, null)))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public VehicleDetailDto get(Long id) {
        Vehicle vehicle = vehicleRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Vehicle not found"));

        Map<Long, RepairService> services = byId(repairServiceRepository.findAll(), RepairService::getId);
        Map<Long, Worker> workers = byId(workerRepository.findAll(), Worker::getId);
        Map<Long, Part> parts = byId(partRepository.findAll(), Part::getId);

        Map<Long, List<VehiclePartDto>> partsByService = servicePartRepository.findByVehicleIdOrderByIdAsc(id).stream()
                .filter(sp -> parts.containsKey(sp.getPartId()))
                .collect(Collectors.groupingBy(VehicleServicePart::getServiceId,
                        Collectors.mapping(sp -> VehiclePartDto.of(parts.get(sp.getPartId()), sp.getQuantity()),
                                Collectors.toList())));

        List<VehiclePartDto> standalone = vehiclePartRepository.findByVehicleIdOrderByIdAsc(id).stream()
                .filter(vp -> parts.containsKey(vp.getPartId()))
                .map(vp -> VehiclePartDto.of(parts.get(vp.getPartId()), vp.getQuantity()))
                .collect(Collectors.toList());

        return new VehicleDetailDto(
                vehicle,
                serviceRows(id, services, workers, partsByService),
                standalone,
                invoiceRepository.findFirstByVehicleIdOrderByIdDesc(id).orElse(null));
    }

    @Transactional(readOnly = true)
    public List<VehicleIdDto> vehicleIds() {
        return vehicleRepository.findAllIds();
    }

    // ------------------------------------------------------------ mutations

    @Transactional(rollbackFor = Exception.class)
    public Vehicle create(VehicleRequest request) {
        Vehicle vehicle = new Vehicle();
        apply(vehicle, request);
        vehicle.setEntryTime(LocalDateTime.now(clock));
        vehicle = vehicleRepository.save(vehicle);

        for (Long serviceId : orEmpty(request.getServiceIds())) {
            requireService(serviceId);
            VehicleServiceEntry entry = new VehicleServiceEntry();
            entry.setVehicleId(vehicle.getId());
            entry.setServiceId(serviceId);
            entry.setStatus(VehicleServiceEntry.PENDING);
            serviceEntryRepository.save(entry);
        }
        insertParts(vehicle.getId(), request);

        log.info("Vehicle {} ({}) checked in with {} service(s)",
                vehicle.getId(), vehicle.getPlate(), orEmpty(request.getServiceIds()).size());
        return vehicle;
    }

    /** Updates the vehicle row and replaces both part lists; scheduled services stay as they are. */
    @Transactional(rollbackFor = Exception.class)
    public Vehicle update(Long id, VehicleRequest request) {
        Vehicle vehicle = vehicleRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Vehicle not found"));
        apply(vehicle, request);
        vehicle = vehicleRepository.save(vehicle);

        vehiclePartRepository.deleteByVehicle(id);
        servicePartRepository.deleteByVehicle(id);
        insertParts(id, request);
        return vehicle;
    }

    @Transactional(rollbackFor = Exception.class)
    public String exit(Long id) {
        Vehicle vehicle = vehicleRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Vehicle not found"));
        if (vehicle.getExitTime() != null) {
            return EXITED;
        }
        if (serviceEntryRepository.countByVehicleIdAndStatusNot(id, VehicleServiceEntry.COMPLETED) > 0) {
            throw new DomainPreconditionException(SERVICES_INCOMPLETE);
        }
        if (invoiceRepository.countByVehicleId(id) == 0) {
            throw new DomainPreconditionException(INVOICE_MISSING);
        }
        vehicle.setExitTime(LocalDateTime.now(clock));
        vehicleRepository.save(vehicle);
        log.info("Vehicle {} ({}) exited", id, vehicle.getPlate());
        return EXITED;
    }

    @Transactional(rollbackFor = Exception.class)
    public void updateServiceStatus(Long vehicleId, Long serviceId, String status, LocalDateTime completedTime) {
        VehicleServiceEntry entry = serviceEntryRepository.findFirstByVehicleIdAndServiceId(vehicleId, serviceId)
                .orElseThrow(() -> new NotFoundException("Service record not found"));
        entry.setStatus(status);
        entry.setCompletedTime(completedTime);
        serviceEntryRepository.save(entry);
    }

    /** Removes the vehicle with its invoices, invoice items and join rows. */
    @Transactional(rollbackFor = Exception.class)
    public void delete(Long id) {
        invoiceItemRepository.deleteByVehicle(id);
        invoiceRepository.deleteByVehicle(id);
        servicePartRepository.deleteByVehicle(id);
        vehiclePartRepository.deleteByVehicle(id);
        serviceEntryRepository.deleteByVehicle(id);
        if (vehicleRepository.deleteVehicle(id) == 0) {
            throw new NotFoundException("Vehicle not found");
        }
        log.info("Vehicle {} deleted", id);
    }

    // -------------------------------------------------------------- helpers

    private void apply(Vehicle vehicle, VehicleRequest request) {
        vehicle.setPlate(request.getPlate());
        vehicle.setMake(request.getMake());
        vehicle.setModelName(request.getModelName());
        vehicle.setYear(request.getYear());
        vehicle.setVin(request.getVin());
        vehicle.setOwner(request.getOwner());
        vehicle.setContactNumber(request.getContactNumber());
    }

    private void insertParts(Long vehicleId, VehicleRequest request) {
        for (VehicleRequest.PartQuantity pq : orEmpty(request.getStandaloneParts())) {
            requirePart(pq.getPartId());
            VehiclePart vp = new VehiclePart();
            vp.setVehicleId(vehicleId);
            vp.setPartId(pq.getPartId());
            vp.setQuantity(pq.getQuantity());
            vehiclePartRepository.save(vp);
        }
        for (VehicleRequest.ServicePartQuantity spq : orEmpty(request.getServiceParts())) {
            requireService(spq.getServiceId());
            requirePart(spq.getPartId());
            VehicleServicePart sp = new VehicleServicePart();
            sp.setVehicleId(vehicleId);
            sp.setServiceId(spq.getServiceId());
            sp.setPartId(spq.getPartId());
            sp.setQuantity(spq.getQuantity());
            servicePartRepository.save(sp);
        }
    }

    private void requireService(Long serviceId) {
        if (!repairServiceRepository.existsById(serviceId)) {
            throw new NotFoundException("Service not found: " + serviceId);
        }
    }

    private void requirePart(Long partId) {
        if (!partRepository.existsById(partId)) {
            throw new NotFoundException("Part not found: " + partId);
        }
    }

    private List<VehicleServiceDto> serviceRows(Long vehicleId,
                                                Map<Long, RepairService> services,
                                                Map<Long, Worker> workers,
                                                Map<Long, List<VehiclePartDto>> partsByService) {
        List<VehicleServiceDto> rows = new ArrayList<>();
        for (VehicleServiceEntry entry : serviceEntryRepository.findByVehicleIdOrderByIdAsc(vehicleId)) {
            RepairService service = services.get(entry.getServiceId());
            Long workerId = service != null ? service.getWorkerId() : null;
            Worker worker = workerId != null ? workers.get(workerId) : null;
            List<VehiclePartDto> parts = partsByService == null ? null
                    : partsByService.getOrDefault(entry.getServiceId(), new ArrayList<>());
            rows.add(new VehicleServiceDto(
                    entry.getServiceId(),
                    service != null ? service.getName() : null,
                    entry.getStatus(),
                    entry.getCompletedTime(),
                    workerId,
                    worker != null ? worker.getName() : null,
                    parts));
        }
        return rows;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private static <T> Map<Long, T> byId(List<T> rows, Function<T, Long> id) {
        return rows.stream().collect(Collectors.toMap(id, Function.identity()));
    }
}
