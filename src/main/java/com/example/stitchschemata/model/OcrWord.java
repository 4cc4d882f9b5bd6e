package com.example.stitchschemata.model;

import lombok.Getter;

import java.awt.Rectangle;

/**
 * One recognized word with its pixel bounding box and confidence (0..100).
 */
@Getter
public class OcrWord {
    private final String text;
    private final Rectangle box;
    private final float confidence;

    public OcrWord(String text, Rectangle box, float confidence) {
        this.text = text;
        this.box = box;
        this.confidence = confidence;
    }
}
