package com.example.stitchschemata.command;

import com.example.stitchschemata.image.TextureMeasure;
import com.example.stitchschemata.model.PageSegMode;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.model.StitchResult;
import com.example.stitchschemata.model.TileHint;
import com.example.stitchschemata.service.ProgressService;
import com.example.stitchschemata.service.StitchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * {@code stitch-schemata stitch}. Defaults of all options come from
 * {@code stitch.*} in {@code application.properties}.
 */
@Component
@Command(name = "stitch", mixinStandardHelpOptions = true, description = "Stitches scanned circuit schema pages.")
@Slf4j
public class StitchCommand implements Callable<Integer> {

    private final StitchService stitchService;
    private final ProgressService progressService;

    @Option(names = {"-o", "--output"}, description = "The stitched output file (.png, .jpg, .jpeg or .pdf). Default: ${DEFAULT-VALUE}.")
    private Path output;

    @Option(names = "--margin", description = "The margin applied when searching for tiles. Default: ${DEFAULT-VALUE}.")
    private int margin;

    @Option(names = "--overlap-min", description = "The minimum overlap of scanned pages as a fraction of the page width. Default: ${DEFAULT-VALUE}.")
    private double overlapMin;

    @Option(names = "--vertical-offset-max", description = "The maximum vertical offset in pixels of the scanned pages. Default: ${DEFAULT-VALUE}.")
    private int verticalOffsetMax;

    @Option(names = "--rotation-max", description = "The maximum rotation in degrees of the scanned pages. Default: ${DEFAULT-VALUE}.")
    private double rotationMax;

    @Option(names = "--tile-width", description = "The width of a tile. Default: ${DEFAULT-VALUE}.")
    private int tileWidth;

    @Option(names = "--tile-height", description = "The height of a tile. Default: ${DEFAULT-VALUE}.")
    private int tileHeight;

    @Option(names = "--tile-shapes-min", description = "The minimum texture score of a tile. Default: ${DEFAULT-VALUE}.")
    private double tileShapesMin;

    @Option(names = "--tile-match-min", description = "The minimum required match for finding a tile. Default: ${DEFAULT-VALUE}.")
    private double tileMatchMin;

    @Option(names = "--tile-iterations-max", description = "The maximum number of iterations for finding the rotation. Default: ${DEFAULT-VALUE}.")
    private int tileIterationsMax;

    @Option(names = "--tile-kernel-fraction", description = "The fraction of the tile width used as blur kernel. Default: ${DEFAULT-VALUE}.")
    private double tileKernelFraction;

    @Option(names = "--texture-measure", description = "How tiles are scored: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}.")
    private TextureMeasure textureMeasure;

    @Option(names = "--tile-hint", converter = TileHintConverter.class,
            description = "The centers of the top and bottom tile of a page (basename:x,y;x,y). Repeatable.")
    private List<TileHint> tileHints = new ArrayList<>();

    @Option(names = "--dpi", description = "The resolution of the scanned images. Default: ${DEFAULT-VALUE}.")
    private int dpi;

    @Option(names = "--no-crop", negatable = true, description = "Keep the full canvas instead of cropping it to the rows all pages cover (--crop restores cropping).")
    private boolean noCrop;

    @Option(names = "--quality", description = "The quality of the stitched image when saved as JPEG or PDF. Default: ${DEFAULT-VALUE}.")
    private int quality;

    @Option(names = "--ocr", description = "Add an invisible OCR text layer when the output is a PDF.")
    private boolean ocr;

    @Option(names = "--ocr-psm", converter = PageSegModeConverter.class, description = "The page segmentation mode used for OCR. Default: ${DEFAULT-VALUE}.")
    private PageSegMode ocrPsm;

    @Option(names = "--ocr-language", description = "The language(s) used for OCR. Default: ${DEFAULT-VALUE}.")
    private String ocrLanguage;

    @Option(names = "--ocr-confidence-min", description = "The minimum OCR confidence of a word in the text layer. Default: ${DEFAULT-VALUE}.")
    private double ocrConfidenceMin;

    @Option(names = "--debug", description = "Keep intermediate images in the temp directory.")
    private boolean debug;

    @Parameters(arity = "1..*", paramLabel = "<pages>", description = "The scanned pages, left to right.")
    private List<Path> pages;

    public StitchCommand(StitchService stitchService, ProgressService progressService) {
        this.stitchService = stitchService;
        this.progressService = progressService;
    }

    @Override
    public Integer call() throws IOException {
        if (debug) {
            StitchSchemataCommand.enableDebugLogging();
        }
        Path tmp = Files.createTempDirectory(Paths.get("").toAbsolutePath(), "stitch-schemata-");
        try {
            StitchResult result = stitchService.stitch(pages, createConfig(tmp));
            progressService.sendProgress(String.format("Stitched %d pages into %dx%d pixels in %.1f s",
                    result.getPages().size(), result.getWidth(), result.getHeight(), result.getTotalTime() / 1000.0));
            return 0;
        } finally {
            if (debug) {
                progressService.sendProgress("Debug images kept in " + tmp);
            } else {
                FileSystemUtils.deleteRecursively(tmp);
            }
        }
    }

    StitchConfig createConfig(Path tmp) {
        Map<String, TileHint> hints = new LinkedHashMap<>();
        for (TileHint hint : tileHints) {
            hints.put(hint.getBasename(), hint);
        }
        return StitchConfig.builder()
                .margin(margin)
                .overlapMin(overlapMin)
                .verticalOffsetMax(verticalOffsetMax)
                .rotationMax(rotationMax)
                .tileWidth(tileWidth)
                .tileHeight(tileHeight)
                .tileShapesMin(tileShapesMin)
                .tileMatchMin(tileMatchMin)
                .tileIterationsMax(tileIterationsMax)
                .tileKernelFraction(tileKernelFraction)
                .textureMeasure(textureMeasure)
                .tileHints(hints)
                .dpi(dpi)
                .crop(!noCrop)
                .quality(quality)
                .tmpPath(tmp.toAbsolutePath())
                .outputPath(output)
                .debug(debug)
                .ocr(ocr)
                .ocrPsm(ocrPsm.getCode())
                .ocrLanguage(ocrLanguage)
                .ocrConfidenceMin(ocrConfidenceMin)
                .build();
    }
}
