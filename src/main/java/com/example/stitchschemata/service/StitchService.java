package com.example.stitchschemata.service;

import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.ScanMetadata;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.model.StitchResult;
import com.example.stitchschemata.service.align.OrientationDetector;
import com.example.stitchschemata.service.align.PageAligner;
import com.example.stitchschemata.service.align.PageAlignment;
import com.example.stitchschemata.service.compose.CanvasComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Stitches overlapping scans of one document, left to right, into a single image.
 *
 * <p>Flow:
 * <ol>
 *   <li>Validate the output format</li>
 *   <li>Straighten the first page from its dominant lines</li>
 *   <li>Align every further page to its predecessor (rotation + translation)</li>
 *   <li>Paint the colour pages onto one canvas, optionally cropped</li>
 *   <li>Encode PNG, JPEG or PDF (with optional OCR text layer)</li>
 * </ol>
 */
@Service
@Slf4j
public class StitchService {

    @Autowired
    private ProgressService progressService;

    @Autowired
    private ImageEncoder imageEncoder;

    @PostConstruct
    public void init() {
        nu.pattern.OpenCV.loadLocally();
        log.info("OpenCV loaded");
    }

    // ==================== Main flow ====================

    public StitchResult stitch(List<Path> pages, StitchConfig config) {
        long start = System.currentTimeMillis();
        imageEncoder.formatOf(config.getOutputPath());
        if (pages.isEmpty()) {
            throw new StitchException("No pages to stitch.");
        }
        log.info("========== Stitching {} pages into {} ==========", pages.size(), config.getOutputPath());

        DebugImageWriter debug = config.isDebug() && config.getTmpPath() != null
                ? new DebugImageWriter(config.getTmpPath())
                : DebugImageWriter.disabled();

        List<ScanMetadata> metadata = preStitch(pages, config, debug);
        progressService.sendMetadata(metadata);

        progressService.sendProgress("Stitching images");
        ScanImage stitched = new CanvasComposer(config, debug).compose(metadata, page -> ScanImage.read(page.getPath()));

        progressService.sendProgress("Saving " + config.getOutputPath());
        imageEncoder.save(stitched, config, pages.get(0));

        long totalTime = System.currentTimeMillis() - start;
        StitchResult result = new StitchResult(config.getOutputPath(), metadata,
                stitched.getWidth(), stitched.getHeight(), totalTime);
        stitched.release();
        log.info("========== Stitching done: {}x{} in {} ms ==========",
                result.getWidth(), result.getHeight(), totalTime);
        progressService.sendProgress("Saved " + config.getOutputPath());
        return result;
    }

    /**
     * Determines rotation and translation of every page. Each page is aligned to
     * its predecessor in its final, rotated form.
     */
    List<ScanMetadata> preStitch(List<Path> pages, StitchConfig config, DebugImageWriter debug) {
        PageAligner aligner = new PageAligner(config, debug);
        List<ScanMetadata> metadata = new ArrayList<>(pages.size());
        ScanImage previous = null;

        for (int i = 0; i < pages.size(); i++) {
            Path path = pages.get(i);
            progressService.sendProgress(String.format("Preprocessing image %s (%d/%d)",
                    path.getFileName(), i + 1, pages.size()));
            ScanImage color = ScanImage.read(path);
            ScanImage grayscale = color.toGrayscale();
            color.release();
            debug.write("grayscale-" + i, grayscale);

            ScanImage placed;
            if (i == 0) {
                double angle = orientFirstPage(path, grayscale, config);
                placed = grayscale.rotate(angle);
                metadata.add(new ScanMetadata(path, angle, 0, 0, placed.getWidth(), placed.getHeight()));
            } else {
                PageAlignment alignment = aligner.align(previous, grayscale, config.tileHintFor(path));
                placed = grayscale.rotate(alignment.getRotation());
                metadata.add(alignment.toMetadata(path));
            }
            log.info("Page {}: {}", i + 1, metadata.get(i));

            if (previous != null) {
                previous.release();
            }
            if (placed != grayscale) {
                grayscale.release();
            }
            previous = placed;
        }
        if (previous != null) {
            previous.release();
        }
        return metadata;
    }

    private double orientFirstPage(Path path, ScanImage grayscale, StitchConfig config) {
        OptionalDouble detected = new OrientationDetector(config.getRotationMax()).detectOrientation(grayscale);
        if (detected.isEmpty()) {
            log.info("No orientation lines found, first page kept as is");
            return 0.0;
        }
        double angle = detected.getAsDouble();
        if (Math.abs(angle) > config.getRotationMax()) {
            log.info("Orientation {}° exceeds the maximum, first page kept as is", String.format("%.4f", angle));
            return 0.0;
        }
        progressService.sendRotationDetected(path.getFileName().toString(), angle);
        return angle;
    }
}
