package com.garageadmin.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A file accepted by an archive upload. */
@Getter
@AllArgsConstructor
public class ArchivedFileDto {
    private String originalName;
    private String filename;
    private String url;
    private long size;
    private String mimetype;
}
