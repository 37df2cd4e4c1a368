package com.garageadmin.controller;

import com.garageadmin.dto.PartRequest;
import com.garageadmin.exception.NotFoundException;
import com.garageadmin.model.Part;
import com.garageadmin.repository.PartRepository;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Parts inventory: plain CRUD, no cross-table rules. */
@RestController
@RequestMapping("/api/parts")
public class PartController {

    private final PartRepository partRepository;

    public PartController(PartRepository partRepository) {
        this.partRepository = partRepository;
    }

    @GetMapping
    public List<Part> list() {
        return partRepository.findAllByOrderByNameAsc();
    }

    @GetMapping("/{id}")
    public Part get(@PathVariable Long id) {
        return find(id);
    }

    @PostMapping
    public ResponseEntity<Part> create(@Valid @RequestBody PartRequest request) {
        Part part = new Part();
        apply(part, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(partRepository.save(part));
    }

    @PutMapping("/{id}")
    public Part update(@PathVariable Long id, @Valid @RequestBody PartRequest request) {
        Part part = find(id);
        apply(part, request);
        return partRepository.save(part);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        if (!partRepository.existsById(id)) {
            throw new NotFoundException("Part not found");
        }
        partRepository.deleteById(id);
        return ResponseEntity.noContent().build();
    }

    private Part find(Long id) {
        return partRepository.findById(id).orElseThrow(() -> new NotFoundException("Part not found"));
    }

    private void apply(Part part, PartRequest request) {
        part.setName(request.getName());
        part.setPartNumber(request.getPartNumber());
        part.setPurchasingCost(request.getPurchasingCost());
        part.setSellingCost(request.getSellingCost());
        part.setQuantityInStock(request.getQuantityInStock() != null ? request.getQuantityInStock() : 0);
    }
}
