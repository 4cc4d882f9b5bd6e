package com.example.stitchschemata.service.compose;

import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.ScanMetadata;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.service.DebugImageWriter;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Scalar;

import java.util.List;
import java.util.function.Function;

/**
 * Paints the rotated colour pages onto one white canvas.
 *
 * <p>Every page after the first skips its leading {@code margin + tileWidth/2}
 * columns so the seam falls where the pages were matched. With cropping enabled
 * the canvas is cut to the rows every page covers.
 */
@Slf4j
public class CanvasComposer {

    private static final Scalar SEAM_COLOR = new Scalar(0, 0, 255);

    private final StitchConfig config;
    private final DebugImageWriter debug;

    public CanvasComposer(StitchConfig config, DebugImageWriter debug) {
        this.config = config;
        this.debug = debug;
    }

    /**
     * @param loader supplies the original colour raster of a page
     */
    public ScanImage compose(List<ScanMetadata> pages, Function<ScanMetadata, ScanImage> loader) {
        CanvasLayout layout = CanvasLayout.of(pages);
        log.info("Canvas {}x{} for {} pages", layout.getWidth(), layout.getHeight(), pages.size());

        ScanImage canvas = null;
        for (int i = 0; i < pages.size(); i++) {
            ScanMetadata page = pages.get(i);
            ScanImage original = loader.apply(page);
            ScanImage rotated = original.rotate(page.getRotation());
            if (canvas == null) {
                canvas = ScanImage.blank(layout.getWidth(), layout.getHeight(), rotated.getChannels());
            }
            int overlapX = i == 0 ? 0 : config.overlapSkip();
            ScanImage.mergeInto(canvas, rotated, layout.offsetX(i), layout.offsetY(i), overlapX);
            log.debug("Painted {} at ({}, {})", page.getPath().getFileName(), layout.offsetX(i), layout.offsetY(i));
            if (rotated != original) {
                rotated.release();
            }
            original.release();
        }

        if (debug.isEnabled()) {
            int[] seams = new int[pages.size() - 1];
            for (int i = 1; i < pages.size(); i++) {
                seams[i - 1] = layout.offsetX(i) + config.overlapSkip();
            }
            ScanImage marked = canvas.drawVerticalLines(SEAM_COLOR, 3, seams);
            debug.write("stitched-seams", marked);
            marked.release();
        }

        if (config.isCrop()) {
            return crop(canvas, layout);
        }
        return canvas;
    }

    private ScanImage crop(ScanImage canvas, CanvasLayout layout) {
        if (!layout.hasCommonSpan()) {
            log.warn("Pages share no common rows, skipping crop");
            return canvas;
        }
        ScanImage cropped = canvas.subImage(0, layout.getCropTop(), canvas.getWidth(),
                layout.getCropBottom() - layout.getCropTop());
        log.debug("Cropped to rows [{}, {})", layout.getCropTop(), layout.getCropBottom());
        canvas.release();
        return cropped;
    }
}
