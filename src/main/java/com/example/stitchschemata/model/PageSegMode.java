package com.example.stitchschemata.model;

import com.example.stitchschemata.exception.StitchException;

import java.util.Locale;

/**
 * Tesseract page segmentation modes, addressable by name or number.
 */
public enum PageSegMode {
    OSD_ONLY(0),
    AUTO_OSD(1),
    AUTO_ONLY(2),
    AUTO(3),
    SINGLE_COLUMN(4),
    SINGLE_BLOCK_VERT_TEXT(5),
    SINGLE_BLOCK(6),
    SINGLE_LINE(7),
    SINGLE_WORD(8),
    CIRCLE_WORD(9),
    SINGLE_CHAR(10),
    SPARSE_TEXT(11),
    SPARSE_TEXT_OSD(12),
    RAW_LINE(13);

    private final int code;

    PageSegMode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Accepts a mode name such as {@code sparse_text} or its number.
     */
    public static PageSegMode parse(String value) {
        String key = value == null ? "" : value.trim();
        for (PageSegMode mode : values()) {
            if (mode.name().equalsIgnoreCase(key.replace('-', '_')) || String.valueOf(mode.code).equals(key)) {
                return mode;
            }
        }
        throw new StitchException("Unknown page segmentation mode '" + value + "'.");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
