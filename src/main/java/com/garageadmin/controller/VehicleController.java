package com.garageadmin.controller;

import com.garageadmin.dto.ServiceStatusRequest;
import com.garageadmin.dto.VehicleDetailDto;
import com.garageadmin.dto.VehicleIdDto;
import com.garageadmin.dto.VehicleRequest;
import com.garageadmin.dto.VehicleSummaryDto;
import com.garageadmin.model.Vehicle;
import com.garageadmin.service.VehicleWorkflowService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class VehicleController {

    private final VehicleWorkflowService workflowService;

    public VehicleController(VehicleWorkflowService workflowService) {
        this.workflowService = workflowService;
    }

    @GetMapping("/vehicles")
    public List<VehicleSummaryDto> list() {
        return workflowService.list();
    }

    @GetMapping("/vehicles/{id}")
    public VehicleDetailDto get(@PathVariable Long id) {
        return workflowService.get(id);
    }

    @PostMapping("/vehicles")
    public ResponseEntity<Vehicle> create(@Valid @RequestBody VehicleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workflowService.create(request));
    }

    @PutMapping("/vehicles/{id}")
    public Vehicle update(@PathVariable Long id, @Valid @RequestBody VehicleRequest request) {
        return workflowService.update(id, request);
    }

    @PutMapping("/vehicles/{id}/exit")
    public Map<String, String> exit(@PathVariable Long id) {
        return Map.of("message", workflowService.exit(id));
    }

    @PutMapping("/vehicles/{vehicleId}/services/{serviceId}")
    public Map<String, String> updateServiceStatus(@PathVariable Long vehicleId,
                                                   @PathVariable Long serviceId,
                                                   @Valid @RequestBody ServiceStatusRequest request) {
        workflowService.updateServiceStatus(vehicleId, serviceId, request.getStatus(), request.getCompletedTime());
        return Map.of("message", "Service status updated successfully");
    }

    @DeleteMapping("/vehicles/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        workflowService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/vehicle-ids")
    public List<VehicleIdDto> vehicleIds() {
        return workflowService.vehicleIds();
    }
}
