package com.example.stitchschemata.model;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Final placement of one page: its rotation and its translation relative to the
 * previous page, plus the size of the rotated (and cropped) raster.
 */
@Getter
public class ScanMetadata {
    private final Path path;
    private final double rotation;
    private final int translateX;
    private final int translateY;
    private final int width;
    private final int height;

    public ScanMetadata(Path path, double rotation, int translateX, int translateY, int width, int height) {
        this.path = path;
        this.rotation = rotation;
        this.translateX = translateX;
        this.translateY = translateY;
        this.width = width;
        this.height = height;
    }

    @Override
    public String toString() {
        return String.format("ScanMetadata[%s, rotation=%.4f, translate=(%d, %d), size=%dx%d]",
                path.getFileName(), rotation, translateX, translateY, width, height);
    }
}
