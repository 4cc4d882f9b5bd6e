package com.example.stitchschemata.model;

import com.example.stitchschemata.exception.UnsupportedOutputFormatException;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Output encodings selected by the extension of the output path.
 */
public enum OutputFormat {
    PNG,
    JPEG,
    PDF;

    /**
     * Resolves the format of an output path (case-insensitive).
     *
     * @throws UnsupportedOutputFormatException for any other extension
     */
    public static OutputFormat of(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".png")) {
            return PNG;
        }
        if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
            return JPEG;
        }
        if (name.endsWith(".pdf")) {
            return PDF;
        }
        throw new UnsupportedOutputFormatException("Unsupported output format: '" + path.getFileName() + "'.");
    }
}
