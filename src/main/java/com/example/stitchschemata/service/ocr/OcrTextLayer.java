package com.example.stitchschemata.service.ocr;

import com.example.stitchschemata.model.OcrWord;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.graphics.state.RenderingMode;

import java.awt.Color;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Writes recognized words as invisible, selectable text over a page image.
 * Each word's font size is chosen so the text spans the word's pixel width.
 */
@Slf4j
public class OcrTextLayer {

    static final String FONT_RESOURCE = "/fonts/DejaVuSans.ttf";

    private static final Color CONFIDENT = Color.GREEN;
    private static final Color FUCHSIA = new Color(255, 0, 255);

    private final PDFont font;

    public OcrTextLayer(PDFont font) {
        this.font = font;
    }

    /**
     * A text layer using the bundled Unicode font, subset-embedded into {@code document} on save.
     */
    public static OcrTextLayer forDocument(PDDocument document) throws IOException {
        try (InputStream in = OcrTextLayer.class.getResourceAsStream(FONT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Font resource not found: " + FONT_RESOURCE);
            }
            return new OcrTextLayer(PDType0Font.load(document, in, true));
        }
    }

    /**
     * @param debug keep words below the confidence minimum and outline every word
     * @return number of words written
     */
    public int draw(PDPageContentStream stream, List<OcrWord> words, PixelsToPoints mapping,
                    double confidenceMin, boolean debug) throws IOException {
        int written = 0;
        for (OcrWord word : words) {
            boolean confident = word.getConfidence() >= confidenceMin;
            if (!confident && !debug) {
                log.trace("Skipping '{}' at confidence {}", word.getText(), word.getConfidence());
                continue;
            }
            String text = encodable(word.getText());
            PDRectangle box = mapping.toPoints(word.getBox());
            float unitWidth = font.getStringWidth(text) / 1000f;
            if (text.isBlank() || unitWidth <= 0 || box.getWidth() <= 0) {
                continue;
            }

            stream.beginText();
            stream.setFont(font, box.getWidth() / unitWidth);
            stream.setRenderingMode(RenderingMode.NEITHER);
            stream.newLineAtOffset(box.getLowerLeftX(), box.getLowerLeftY());
            stream.showText(text);
            stream.endText();
            written++;

            if (debug) {
                stream.setStrokingColor(confident ? CONFIDENT : FUCHSIA);
                stream.setLineWidth(0.5f);
                stream.addRect(box.getLowerLeftX(), box.getLowerLeftY(), box.getWidth(), box.getHeight());
                stream.stroke();
            }
        }
        return written;
    }

    /**
     * Replaces code points the font has no glyph for with '?'.
     */
    String encodable(String text) throws IOException {
        StringBuilder result = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            String c = new String(Character.toChars(codePoint));
            try {
                font.encode(c);
                result.append(c);
            } catch (IllegalArgumentException e) {
                log.debug("No glyph for U+{} in {}", String.format("%04X", codePoint), font.getName());
                result.append('?');
            }
            i += Character.charCount(codePoint);
        }
        return result.toString();
    }
}
