package com.example.stitchschemata.service;

import com.example.stitchschemata.image.ScanImage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes intermediate images of one run into its temp directory, numbered in the
 * order they are produced. A disabled writer ignores every call.
 */
@Slf4j
public class DebugImageWriter {

    private static final DebugImageWriter DISABLED = new DebugImageWriter(null);

    private final Path directory;
    private int sequence;

    public DebugImageWriter(Path directory) {
        this.directory = directory;
    }

    public static DebugImageWriter disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return directory != null;
    }

    /**
     * Writes {@code NNN-name.png}; failures are logged and do not abort the run.
     */
    public void write(String name, ScanImage image) {
        if (!isEnabled()) {
            return;
        }
        Path target = directory.resolve(String.format("%03d-%s.png", ++sequence, name));
        try {
            Files.createDirectories(directory);
            image.write(target);
            log.debug("Debug image written: {}", target);
        } catch (IOException e) {
            log.warn("Failed to write debug image {}", target, e);
        }
    }

    int getSequence() {
        return sequence;
    }
}
