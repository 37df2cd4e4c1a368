package com.garageadmin.controller;

import com.garageadmin.dto.PaymentRequest;
import com.garageadmin.dto.WorkerPaymentsDto;
import com.garageadmin.dto.WorkerRequest;
import com.garageadmin.model.Worker;
import com.garageadmin.model.WorkerPayment;
import com.garageadmin.pdf.PaymentReportPdfService;
import com.garageadmin.pdf.RenderedPdf;
import com.garageadmin.service.WorkerService;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/workers")
public class WorkerController {

    private final WorkerService workerService;
    private final PaymentReportPdfService reportPdfService;

    public WorkerController(WorkerService workerService, PaymentReportPdfService reportPdfService) {
        this.workerService = workerService;
        this.reportPdfService = reportPdfService;
    }

    @GetMapping
    public List<Worker> list() {
        return workerService.list();
    }

    @GetMapping("/{id}")
    public Worker get(@PathVariable Long id) {
        return workerService.get(id);
    }

    @PostMapping
    public ResponseEntity<Worker> create(@Valid @RequestBody WorkerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workerService.create(request));
    }

    @PutMapping("/{id}")
    public Worker update(@PathVariable Long id, @Valid @RequestBody WorkerRequest request) {
        return workerService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        workerService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // --- Payments ---

    @PostMapping("/{id}/payments")
    public ResponseEntity<WorkerPayment> addPayment(@PathVariable Long id, @Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(workerService.addPayment(id, request));
    }

    @GetMapping("/{id}/payments")
    public WorkerPaymentsDto payments(@PathVariable Long id) {
        return workerService.payments(id);
    }

    @GetMapping("/{id}/payments/total")
    public Map<String, BigDecimal> totalPaid(@PathVariable Long id) {
        return Map.of("total_paid", workerService.totalPaid(id));
    }

    @GetMapping("/{id}/payments/pdf")
    public ResponseEntity<byte[]> paymentsPdf(@PathVariable Long id) throws IOException {
        RenderedPdf pdf = reportPdfService.render(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(pdf.getFilename(), StandardCharsets.UTF_8).build().toString())
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf.getContent());
    }
}
