package com.garageadmin.controller;

import com.garageadmin.dto.AssignWorkerRequest;
import com.garageadmin.dto.ServiceRequest;
import com.garageadmin.dto.ServiceRowDto;
import com.garageadmin.service.ServiceCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/services")
public class ServiceCatalogController {

    private final ServiceCatalogService catalogService;

    public ServiceCatalogController(ServiceCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<ServiceRowDto> list() {
        return catalogService.list();
    }

    @PostMapping
    public ResponseEntity<ServiceRowDto> create(@Valid @RequestBody ServiceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.create(request));
    }

    @PutMapping("/{id}/assign-worker")
    public ServiceRowDto assignWorker(@PathVariable Long id, @Valid @RequestBody AssignWorkerRequest request) {
        return catalogService.assignWorker(id, request.getWorkerId());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        catalogService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
