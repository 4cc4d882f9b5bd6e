package com.example.stitchschemata.service.ocr;

import com.example.stitchschemata.model.OcrConfig;
import com.example.stitchschemata.model.OcrWord;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Word-level text recognition.
 */
public interface OcrEngine {
    List<OcrWord> recognize(BufferedImage image, OcrConfig config);
}
