package com.example.stitchschemata.service.ocr;

import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.model.OcrWord;
import com.example.stitchschemata.service.ProgressService;
import com.example.stitchschemata.service.pdf.PdfImageWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Recognizes text in raster images and turns an image into a searchable PDF.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OcrService {

    private final OcrEngine ocrEngine;
    private final PdfImageWriter pdfImageWriter;
    private final ProgressService progressService;

    public List<OcrWord> recognize(BufferedImage image, OcrConfig config) {
        long start = System.currentTimeMillis();
        List<OcrWord> words = ocrEngine.recognize(image, config);
        long confident = words.stream().filter(w -> w.getConfidence() >= config.getConfidenceMin()).count();
        log.info("OCR found {} words, {} above confidence {} ({} ms)", words.size(), confident,
                String.format("%.1f", config.getConfidenceMin()), System.currentTimeMillis() - start);
        return words;
    }

    /**
     * Writes {@code input} as a single-page PDF with an invisible text layer.
     */
    public void ocr(Path input, Path output, OcrConfig config) {
        progressService.sendProgress("Recognizing text in " + input.getFileName());
        ScanImage image = ScanImage.read(input);
        BufferedImage buffered = image.toBufferedImage();
        image.release();

        List<OcrWord> words = recognize(buffered, config);
        try {
            pdfImageWriter.write(buffered, pdfImageWriter.resolveProfile(input), words, config, output);
        } catch (IOException e) {
            throw new StitchException("Unable to write '" + output + "': " + e.getMessage(), e);
        }
        progressService.sendProgress("Saved " + output);
    }
}
