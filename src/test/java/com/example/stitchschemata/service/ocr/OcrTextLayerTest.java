package com.example.stitchschemata.service.ocr;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OcrTextLayerTest {

    private PDDocument document;
    private OcrTextLayer layer;

    @BeforeEach
    void setUp() throws Exception {
        document = new PDDocument();
        layer = OcrTextLayer.forDocument(document);
    }

    @AfterEach
    void tearDown() throws Exception {
        document.close();
    }

    @Test
    void keepsLatinCharacters() throws Exception {
        assertThat(layer.encodable("R12 Ü=5V")).isEqualTo("R12 Ü=5V");
    }

    @Test
    void keepsSchematicSymbols() throws Exception {
        assertThat(layer.encodable("Ω10k")).isEqualTo("Ω10k");
        assertThat(layer.encodable("3µF→")).isEqualTo("3µF→");
        assertThat(layer.encodable("±5%")).isEqualTo("±5%");
    }

    @Test
    void replacesCodePointsWithoutGlyph() throws Exception {
        assertThat(layer.encodable("A中B")).isEqualTo("A?B");
    }
}
