package com.garageadmin.service;

import com.garageadmin.dto.ServiceRequest;
import com.garageadmin.dto.ServiceRowDto;
import com.garageadmin.exception.NotFoundException;
import com.garageadmin.model.RepairService;
import com.garageadmin.repository.RepairServiceRepository;
import com.garageadmin.repository.VehicleServiceEntryRepository;
import com.garageadmin.repository.VehicleServicePartRepository;
import com.garageadmin.repository.WorkerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
public class ServiceCatalogService {

    private final RepairServiceRepository repairServiceRepository;
    private final WorkerRepository workerRepository;
    private final VehicleServiceEntryRepository serviceEntryRepository;
    private final VehicleServicePartRepository servicePartRepository;

    public ServiceCatalogService(RepairServiceRepository repairServiceRepository,
                                 WorkerRepository workerRepository,
                                 VehicleServiceEntryRepository serviceEntryRepository,
                                 VehicleServicePartRepository servicePartRepository) {
        this.repairServiceRepository = repairServiceRepository;
        this.workerRepository = workerRepository;
        this.serviceEntryRepository = serviceEntryRepository;
        this.servicePartRepository = servicePartRepository;
    }

    public List<ServiceRowDto> list() {
        return repairServiceRepository.findAllRows();
    }

    @Transactional(rollbackFor = Exception.class)
    public ServiceRowDto create(ServiceRequest request) {
        if (request.getWorkerId() != null && !workerRepository.existsById(request.getWorkerId())) {
            throw new NotFoundException("Worker not found");
        }
        RepairService service = new RepairService();
        service.setName(request.getName());
        service.setCategory(request.getCategory());
        service.setWorkerId(request.getWorkerId());
        service = repairServiceRepository.save(service);
        return row(service.getId());
    }

    @Transactional(rollbackFor = Exception.class)
    public ServiceRowDto assignWorker(Long serviceId, Long workerId) {
        RepairService service = repairServiceRepository.findById(serviceId)
                .orElseThrow(() -> new NotFoundException("Service not found"));
        if (!workerRepository.existsById(workerId)) {
            throw new NotFoundException("Worker not found");
        }
        service.setWorkerId(workerId);
        repairServiceRepository.saveAndFlush(service);
        return row(serviceId);
    }

    /** Also drops the service from every vehicle it was scheduled on. */
    @Transactional(rollbackFor = Exception.class)
    public void delete(Long id) {
        servicePartRepository.deleteByService(id);
        serviceEntryRepository.deleteByService(id);
        if (repairServiceRepository.deleteService(id) == 0) {
            throw new NotFoundException("Service not found");
        }
        log.info("Service {} deleted", id);
    }

    private ServiceRowDto row(Long id) {
        return repairServiceRepository.findRowById(id)
                .orElseThrow(() -> new NotFoundException("Service not found"));
    }
}
