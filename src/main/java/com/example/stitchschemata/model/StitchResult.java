package com.example.stitchschemata.model;

import lombok.Getter;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a stitch run.
 */
@Getter
public class StitchResult {
    private final Path outputPath;
    private final List<ScanMetadata> pages;
    private final int width;
    private final int height;
    private final long totalTime;

    public StitchResult(Path outputPath, List<ScanMetadata> pages, int width, int height, long totalTime) {
        this.outputPath = outputPath;
        this.pages = List.copyOf(pages);
        this.width = width;
        this.height = height;
        this.totalTime = totalTime;
    }
}
