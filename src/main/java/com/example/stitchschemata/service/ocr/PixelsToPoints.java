package com.example.stitchschemata.service.ocr;

import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.awt.Rectangle;

/**
 * Maps image pixels (origin top-left) to PDF points (origin bottom-left) at a
 * given resolution.
 */
public class PixelsToPoints {

    private static final double POINTS_PER_INCH = 72.0;

    private final int dpi;
    private final int imageHeight;

    public PixelsToPoints(int dpi, int imageHeight) {
        this.dpi = dpi;
        this.imageHeight = imageHeight;
    }

    public float toPoints(double pixels) {
        return (float) (POINTS_PER_INCH * pixels / dpi);
    }

    public PDRectangle toPoints(Rectangle box) {
        return new PDRectangle(
                toPoints(box.x),
                toPoints(imageHeight - box.y - box.height),
                toPoints(box.width),
                toPoints(box.height));
    }
}
