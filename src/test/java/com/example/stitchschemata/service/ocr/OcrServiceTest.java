package com.example.stitchschemata.service.ocr;

import com.example.stitchschemata.SyntheticScans;
import com.example.stitchschemata.exception.ImageDecodeException;
import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.model.OcrWord;
import com.example.stitchschemata.service.ProgressService;
import com.example.stitchschemata.service.pdf.PdfImageWriter;
import com.example.stitchschemata.service.pdf.PdfMetadataStamper;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Rectangle;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OcrServiceTest {

    @TempDir
    Path tempDir;

    private OcrService ocrService;
    private OcrConfig config;

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    @BeforeEach
    void setUp() {
        OcrEngine engine = (image, cfg) -> List.of(
                new OcrWord("GND", new Rectangle(100, 100, 120, 40), 91f),
                new OcrWord("smudge", new Rectangle(300, 300, 120, 40), 12f));
        ocrService = new OcrService(engine, new PdfImageWriter(new PdfMetadataStamper()),
                new ProgressService(new PrintStream(OutputStream.nullOutputStream())));
        config = OcrConfig.builder()
                .dpi(300)
                .quality(90)
                .psm(11)
                .language("eng")
                .confidenceMin(60.0)
                .tmpPath(tempDir)
                .build();
    }

    @Test
    void writesSearchablePdfFromImage() throws Exception {
        Path input = SyntheticScans.save(SyntheticScans.texturedCanvas(600, 450, 61), tempDir.resolve("scan.png"));
        Path output = tempDir.resolve("scan.pdf");

        ocrService.ocr(input, output, config);

        try (PDDocument document = PDDocument.load(output.toFile())) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
            assertThat(document.getPage(0).getMediaBox().getWidth()).isEqualTo(144f);
            assertThat(document.getPage(0).getMediaBox().getHeight()).isEqualTo(108f);
            String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("GND").doesNotContain("smudge");
        }
    }

    @Test
    void unreadableInputFails() {
        assertThatThrownBy(() -> ocrService.ocr(tempDir.resolve("missing.png"), tempDir.resolve("out.pdf"), config))
                .isInstanceOf(ImageDecodeException.class);
    }
}
