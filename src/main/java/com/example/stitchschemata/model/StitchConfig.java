package com.example.stitchschemata.model;

import com.example.stitchschemata.image.TextureMeasure;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable settings of one stitch run. Defaults live in
 * {@code application.properties}; the builder only validates.
 */
@Getter
public class StitchConfig {

    // ==================== Tile search ====================

    /** Pixels kept free along every page border when looking for tiles. */
    private final int margin;
    /** Minimum horizontal overlap of neighbouring pages as a fraction of the page width. */
    private final double overlapMin;
    /** Maximum vertical shift (pixels) between neighbouring pages. */
    private final int verticalOffsetMax;
    /** Maximum rotation (degrees) of a page against its neighbour. */
    private final double rotationMax;
    private final int tileWidth;
    private final int tileHeight;
    private final double tileShapesMin;
    private final double tileMatchMin;
    private final int tileIterationsMax;
    private final double tileKernelFraction;
    private final TextureMeasure textureMeasure;
    private final Map<String, TileHint> tileHints;

    // ==================== Output ====================

    private final int dpi;
    private final boolean crop;
    private final int quality;
    private final Path tmpPath;
    private final Path outputPath;
    private final boolean debug;

    // ==================== OCR ====================

    private final boolean ocr;
    private final int ocrPsm;
    private final String ocrLanguage;
    private final double ocrConfidenceMin;

    @Builder(toBuilder = true)
    private StitchConfig(int margin, double overlapMin, int verticalOffsetMax, double rotationMax,
                         int tileWidth, int tileHeight, double tileShapesMin, double tileMatchMin,
                         int tileIterationsMax, double tileKernelFraction, TextureMeasure textureMeasure,
                         Map<String, TileHint> tileHints, int dpi, boolean crop, int quality, Path tmpPath,
                         Path outputPath, boolean debug, boolean ocr, int ocrPsm, String ocrLanguage,
                         double ocrConfidenceMin) {
        require(margin >= 0, "margin must not be negative");
        require(overlapMin > 0 && overlapMin <= 1, "overlap-min must be in (0, 1]");
        require(verticalOffsetMax >= 0, "vertical-offset-max must not be negative");
        require(rotationMax > 0, "rotation-max must be positive");
        require(tileWidth > 0 && tileHeight > 0, "tile size must be positive");
        require(tileMatchMin >= -1 && tileMatchMin <= 1, "tile-match-min must be in [-1, 1]");
        require(tileIterationsMax >= 1, "tile-iterations-max must be at least 1");
        require(tileKernelFraction > 0 && tileKernelFraction <= 1, "tile-kernel-fraction must be in (0, 1]");
        require(dpi > 0, "dpi must be positive");
        require(quality >= 1 && quality <= 100, "quality must be in 1..100");
        require(outputPath != null, "output path is required");
        this.margin = margin;
        this.overlapMin = overlapMin;
        this.verticalOffsetMax = verticalOffsetMax;
        this.rotationMax = rotationMax;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.tileShapesMin = tileShapesMin;
        this.tileMatchMin = tileMatchMin;
        this.tileIterationsMax = tileIterationsMax;
        this.tileKernelFraction = tileKernelFraction;
        this.textureMeasure = textureMeasure == null ? TextureMeasure.SHAPES : textureMeasure;
        this.tileHints = tileHints == null ? Map.of() : Map.copyOf(tileHints);
        this.dpi = dpi;
        this.crop = crop;
        this.quality = quality;
        this.tmpPath = tmpPath;
        this.outputPath = outputPath;
        this.debug = debug;
        this.ocr = ocr;
        this.ocrPsm = ocrPsm;
        this.ocrLanguage = ocrLanguage;
        this.ocrConfidenceMin = ocrConfidenceMin;
    }

    /**
     * Odd Gaussian kernel size derived from the tile width.
     */
    public int kernelSize() {
        int size = Math.max(1, (int) Math.round(tileKernelFraction * tileWidth));
        return size % 2 == 0 ? size + 1 : size;
    }

    /**
     * Number of leading columns of every page after the first that are not painted,
     * so the seam falls inside the matched region.
     */
    public int overlapSkip() {
        return margin + tileWidth / 2;
    }

    public TileHint tileHintFor(Path page) {
        return tileHints.get(page.getFileName().toString());
    }

    public OcrConfig toOcrConfig() {
        return OcrConfig.builder()
                .dpi(dpi)
                .quality(quality)
                .psm(ocrPsm)
                .language(ocrLanguage)
                .confidenceMin(ocrConfidenceMin)
                .tmpPath(tmpPath)
                .debug(debug)
                .build();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
