package com.garageadmin.pdf;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A generated document and the filename it should be downloaded as. */
@Getter
@AllArgsConstructor
public class RenderedPdf {
    private final String filename;
    private final byte[] content;
}
