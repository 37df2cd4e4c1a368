package com.garageadmin.controller;

import com.garageadmin.dto.ArchiveEntryDto;
import com.garageadmin.dto.ArchivedFileDto;
import com.garageadmin.service.ArchiveService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Scanned paper invoices, filed by year. */
@RestController
@RequestMapping("/api/archive/files")
public class ArchiveController {

    private final ArchiveService archiveService;

    public ArchiveController(ArchiveService archiveService) {
        this.archiveService = archiveService;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> upload(@RequestParam("year") String year,
                                                      @RequestParam(value = "files", required = false) List<MultipartFile> files)
            throws IOException {
        year = year.trim();
        List<ArchivedFileDto> stored = archiveService.store(year, files);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", true);
        body.put("year", year);
        body.put("files", stored);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{year}")
    public Map<String, Object> list(@PathVariable String year) throws IOException {
        List<ArchiveEntryDto> files = archiveService.list(year);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("year", year);
        body.put("files", files);
        return body;
    }
}
