package com.example.stitchschemata.service;

import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.model.OcrWord;
import com.example.stitchschemata.model.OutputFormat;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.service.ocr.OcrService;
import com.example.stitchschemata.service.pdf.PdfImageWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the stitched raster in the format selected by the output path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImageEncoder {

    private final PdfImageWriter pdfImageWriter;
    private final OcrService ocrService;

    /**
     * Validates the output path before any work is done.
     */
    public OutputFormat formatOf(Path output) {
        return OutputFormat.of(output);
    }

    /**
     * @param profileSource image whose ICC profile is carried into a PDF output
     */
    public void save(ScanImage image, StitchConfig config, Path profileSource) {
        Path output = config.getOutputPath();
        OutputFormat format = formatOf(output);
        long start = System.currentTimeMillis();
        try {
            switch (format) {
                case PNG:
                case JPEG:
                    image.write(output, format, config.getQuality());
                    break;
                case PDF:
                    writePdf(image, config, profileSource);
                    break;
                default:
                    throw new IllegalStateException("Unhandled format " + format);
            }
        } catch (IOException e) {
            throw new StitchException("Unable to write '" + output + "': " + e.getMessage(), e);
        }
        log.info("Saved {} as {} in {} ms", output, format, System.currentTimeMillis() - start);
    }

    private void writePdf(ScanImage image, StitchConfig config, Path profileSource) throws IOException {
        OcrConfig ocrConfig = config.toOcrConfig();
        BufferedImage buffered = image.toBufferedImage();
        List<OcrWord> words = config.isOcr() ? ocrService.recognize(buffered, ocrConfig) : List.of();
        pdfImageWriter.write(buffered, pdfImageWriter.resolveProfile(profileSource), words, ocrConfig,
                config.getOutputPath());
    }
}
