package com.example.stitchschemata.model;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Settings for text recognition and for the PDF page the text layer is written to.
 */
@Getter
@Builder
public class OcrConfig {
    private final int dpi;
    private final int quality;
    /** Tesseract page segmentation mode. */
    private final int psm;
    /** Tesseract language(s), joined with '+'. */
    private final String language;
    private final double confidenceMin;
    private final Path tmpPath;
    private final boolean debug;
}
