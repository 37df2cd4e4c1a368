package com.garageadmin.service;

import com.garageadmin.config.GarageProperties;
import com.garageadmin.dto.ArchiveEntryDto;
import com.garageadmin.dto.ArchivedFileDto;
import com.garageadmin.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Year-bucketed store for scanned paper invoices:
 * {@code <upload-root>/invoices/<year>/<epochMillis>_<safe name>}.
 * Independent of the database.
 */
@Service
@Slf4j
public class ArchiveService {

    public static final int MAX_FILES = 20;

    private static final Pattern YEAR = Pattern.compile("^\\d{4}$");
    private static final Pattern UNSAFE = Pattern.compile("[^\\w.\\-() ]+");

    private final Path invoicesDir;
    private final Clock clock;

    public ArchiveService(GarageProperties properties, Clock clock) throws IOException {
        this.invoicesDir = Paths.get(properties.getUploadRoot()).toAbsolutePath().normalize().resolve("invoices");
        this.clock = clock;
        Files.createDirectories(this.invoicesDir);
    }

    public List<ArchivedFileDto> store(String year, List<MultipartFile> files) throws IOException {
        Path dir = yearDir(year);
        if (files == null) {
            files = List.of();
        }
        if (files.size() > MAX_FILES) {
            throw new ValidationException("At most " + MAX_FILES + " files per upload.");
        }
        Files.createDirectories(dir);

        List<ArchivedFileDto> stored = new ArrayList<>();
        for (MultipartFile file : files) {
            String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "file" : file.getOriginalFilename());
            String filename = clock.millis() + "_" + safeName(original);
            Path target = dir.resolve(filename);
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
            stored.add(new ArchivedFileDto(original, filename, url(year, filename), file.getSize(), file.getContentType()));
        }
        log.info("Archived {} file(s) under {}", stored.size(), dir);
        return stored;
    }

    /** Files already in the bucket, by name; empty when the year has no directory yet. */
    public List<ArchiveEntryDto> list(String year) throws IOException {
        Path dir = yearDir(year);
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .map(name -> new ArchiveEntryDto(name, url(year, name)))
                    .collect(Collectors.toList());
        }
    }

    static String safeName(String original) {
        String name = original.substring(Math.max(original.lastIndexOf('/'), original.lastIndexOf('\\')) + 1);
        return UNSAFE.matcher(name).replaceAll("_");
    }

    private Path yearDir(String year) {
        if (year == null || !YEAR.matcher(year).matches()) {
            throw new ValidationException("Invalid year");
        }
        return invoicesDir.resolve(year);
    }

    private static String url(String year, String filename) {
        return "/uploads/invoices/" + year + "/" + filename;
    }
}
