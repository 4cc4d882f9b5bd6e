package com.example.stitchschemata.command;

import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.model.PageSegMode;
import com.example.stitchschemata.service.ocr.OcrService;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * {@code stitch-schemata ocr}: image in, searchable PDF out.
 */
@Component
@Command(name = "ocr", mixinStandardHelpOptions = true, description = "Generates a PDF file with OCR from an image.")
public class OcrCommand implements Callable<Integer> {

    private final OcrService ocrService;

    @Option(names = {"-i", "--input"}, required = true, description = "The path to the input image.")
    private Path input;

    @Option(names = {"-o", "--output"}, required = true, description = "The path to the output PDF with OCR.")
    private Path output;

    @Option(names = "--quality", description = "The quality of the image when saved in the PDF. Default: ${DEFAULT-VALUE}.")
    private int quality;

    @Option(names = "--dpi", description = "The resolution of the scanned image. Default: ${DEFAULT-VALUE}.")
    private int dpi;

    @Option(names = "--ocr-psm", converter = PageSegModeConverter.class, description = "The page segmentation mode used for OCR. Default: ${DEFAULT-VALUE}.")
    private PageSegMode ocrPsm;

    @Option(names = "--ocr-language", description = "The language(s) used for OCR. Default: ${DEFAULT-VALUE}.")
    private String ocrLanguage;

    @Option(names = "--ocr-confidence-min", description = "The minimum OCR confidence of a word in the text layer. Default: ${DEFAULT-VALUE}.")
    private double ocrConfidenceMin;

    @Option(names = "--debug", description = "Keep low-confidence words and outline all words.")
    private boolean debug;

    public OcrCommand(OcrService ocrService) {
        this.ocrService = ocrService;
    }

    @Override
    public Integer call() throws IOException {
        if (debug) {
            StitchSchemataCommand.enableDebugLogging();
        }
        Path tmp = Files.createTempDirectory(Paths.get("").toAbsolutePath(), "stitch-schemata-");
        try {
            ocrService.ocr(input, output, createConfig(tmp));
            return 0;
        } finally {
            if (!debug) {
                FileSystemUtils.deleteRecursively(tmp);
            }
        }
    }

    OcrConfig createConfig(Path tmp) {
        return OcrConfig.builder()
                .dpi(dpi)
                .quality(quality)
                .psm(ocrPsm.getCode())
                .language(ocrLanguage)
                .confidenceMin(ocrConfidenceMin)
                .tmpPath(tmp.toAbsolutePath())
                .debug(debug)
                .build();
    }
}
