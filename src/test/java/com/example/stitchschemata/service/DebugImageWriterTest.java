package com.example.stitchschemata.service;

import com.example.stitchschemata.SyntheticScans;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class DebugImageWriterTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void numbersImagesInWriteOrder() {
        Path directory = tempDir.resolve("debug");
        DebugImageWriter writer = new DebugImageWriter(directory);

        writer.write("first", SyntheticScans.blankCanvas(20, 20));
        writer.write("second", SyntheticScans.blankCanvas(20, 20));

        assertThat(directory.resolve("001-first.png")).exists();
        assertThat(directory.resolve("002-second.png")).exists();
        assertThat(writer.getSequence()).isEqualTo(2);
    }

    @Test
    void disabledWriterIgnoresImages() throws Exception {
        DebugImageWriter writer = DebugImageWriter.disabled();

        writer.write("ignored", SyntheticScans.blankCanvas(20, 20));

        assertThat(writer.isEnabled()).isFalse();
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void writeFailureDoesNotAbort() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");
        DebugImageWriter writer = new DebugImageWriter(blocker.resolve("debug"));

        writer.write("image", SyntheticScans.blankCanvas(20, 20));

        assertThat(writer.getSequence()).isEqualTo(1);
    }
}
