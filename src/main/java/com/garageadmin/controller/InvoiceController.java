package com.garageadmin.controller;

import com.garageadmin.dto.InvoiceDetailDto;
import com.garageadmin.dto.InvoiceRequest;
import com.garageadmin.dto.InvoiceRowDto;
import com.garageadmin.pdf.InvoicePdfService;
import com.garageadmin.pdf.RenderedPdf;
import com.garageadmin.service.InvoiceService;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/invoices")
public class InvoiceController {

    private final InvoiceService invoiceService;
    private final InvoicePdfService invoicePdfService;

    public InvoiceController(InvoiceService invoiceService, InvoicePdfService invoicePdfService) {
        this.invoiceService = invoiceService;
        this.invoicePdfService = invoicePdfService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody InvoiceRequest request) {
        Long id = invoiceService.create(request);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Invoice created successfully");
        body.put("invoice_id", id);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    public List<InvoiceRowDto> list() {
        return invoiceService.list();
    }

    @GetMapping("/{id}")
    public InvoiceDetailDto get(@PathVariable Long id) {
        return invoiceService.get(id);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        invoiceService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/pdf")
    public ResponseEntity<byte[]> pdf(@PathVariable Long id) throws IOException {
        RenderedPdf pdf = invoicePdfService.render(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(pdf.getFilename()).build().toString())
                .contentType(MediaType.APPLICATION_PDF)
                .body(pdf.getContent());
    }
}
