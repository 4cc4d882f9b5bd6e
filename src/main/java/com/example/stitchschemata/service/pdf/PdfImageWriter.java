package com.example.stitchschemata.service.pdf;

import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.model.OcrWord;
import com.example.stitchschemata.service.ocr.OcrTextLayer;
import com.example.stitchschemata.service.ocr.PixelsToPoints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.color.PDOutputIntent;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Service;

import java.awt.color.ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Calendar;
import java.util.List;
import java.util.Optional;

/**
 * Builds a single-page PDF from a raster: page size follows the image at the
 * configured DPI, the image is embedded as JPEG (or losslessly at quality 100),
 * an ICC output intent is attached and an optional OCR text layer is drawn.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PdfImageWriter {

    private static final String CUSTOM_RGB = "Custom RGB";

    private final PdfMetadataStamper metadataStamper;

    public void write(BufferedImage image, ICC_Profile profile, List<OcrWord> words, OcrConfig config, Path output)
            throws IOException {
        long start = System.currentTimeMillis();
        try (PDDocument document = new PDDocument()) {
            PixelsToPoints mapping = new PixelsToPoints(config.getDpi(), image.getHeight());
            PDRectangle size = new PDRectangle(mapping.toPoints(image.getWidth()), mapping.toPoints(image.getHeight()));
            PDPage page = new PDPage(size);
            document.addPage(page);

            PDImageXObject pdImage = config.getQuality() >= 100
                    ? LosslessFactory.createFromImage(document, image)
                    : JPEGFactory.createFromImage(document, image, config.getQuality() / 100f, config.getDpi());

            int written = 0;
            try (PDPageContentStream stream = new PDPageContentStream(
                    document, page, PDPageContentStream.AppendMode.OVERWRITE, true, true)) {
                stream.drawImage(pdImage, 0, 0, size.getWidth(), size.getHeight());
                if (!words.isEmpty()) {
                    written = OcrTextLayer.forDocument(document)
                            .draw(stream, words, mapping, config.getConfidenceMin(), config.isDebug());
                }
            }

            addOutputIntent(document, profile);
            metadataStamper.stamp(document, PdfMetadataStamper.CREATOR_TOOL, Calendar.getInstance());
            document.save(output.toFile());
            log.info("PDF written: {} ({}x{} pt, {} words, {} ms)", output,
                    String.format("%.2f", size.getWidth()), String.format("%.2f", size.getHeight()),
                    written, System.currentTimeMillis() - start);
        }
    }

    /**
     * The RGB profile embedded in the given image, or the JDK's sRGB profile.
     */
    public ICC_Profile resolveProfile(Path source) {
        try {
            Optional<ICC_Profile> embedded = ScanImage.readIccProfile(source);
            if (embedded.isPresent() && embedded.get().getColorSpaceType() == ColorSpace.TYPE_RGB) {
                log.debug("Using ICC profile embedded in {}", source.getFileName());
                return embedded.get();
            }
        } catch (IOException e) {
            log.warn("Unable to read ICC profile of {}, falling back to sRGB", source, e);
        }
        return ICC_Profile.getInstance(ColorSpace.CS_sRGB);
    }

    private void addOutputIntent(PDDocument document, ICC_Profile profile) throws IOException {
        String label = describe(profile).orElse(CUSTOM_RGB);
        PDOutputIntent intent = new PDOutputIntent(document, new ByteArrayInputStream(profile.getData()));
        intent.setInfo(label);
        intent.setOutputCondition(label);
        intent.setOutputConditionIdentifier(label);
        intent.setRegistryName("http://www.color.org");
        document.getDocumentCatalog().addOutputIntent(intent);
    }

    /**
     * The profile's description tag, either the ICC v2 {@code desc} or the v4 {@code mluc} form.
     */
    static Optional<String> describe(ICC_Profile profile) {
        return describe(profile.getData(ICC_Profile.icSigProfileDescriptionTag));
    }

    static Optional<String> describe(byte[] tag) {
        if (tag == null || tag.length < 12) {
            return Optional.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(tag);
        String type = new String(tag, 0, 4, StandardCharsets.US_ASCII);
        String description = null;
        if ("desc".equals(type)) {
            int length = buffer.getInt(8);
            if (length > 0 && 12 + length <= tag.length) {
                description = new String(tag, 12, length, StandardCharsets.US_ASCII);
            }
        } else if ("mluc".equals(type) && tag.length >= 28 && buffer.getInt(8) > 0) {
            int length = buffer.getInt(20);
            int offset = buffer.getInt(24);
            if (length > 0 && offset >= 0 && offset + length <= tag.length) {
                description = new String(tag, offset, length, StandardCharsets.UTF_16BE);
            }
        }
        if (description == null) {
            return Optional.empty();
        }
        description = description.replace("\0", "").trim();
        return description.isEmpty() ? Optional.empty() : Optional.of(description);
    }
}
