package com.garageadmin.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A file already present in a year bucket. */
@Getter
@AllArgsConstructor
public class ArchiveEntryDto {
    private String name;
    private String url;
}
