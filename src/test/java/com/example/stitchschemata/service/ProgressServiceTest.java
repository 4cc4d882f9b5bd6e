package com.example.stitchschemata.service;

import com.example.stitchschemata.model.ScanMetadata;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressServiceTest {

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private final ProgressService progressService =
            new ProgressService(new PrintStream(console, true, StandardCharsets.UTF_8));

    @Test
    void metadataTableHasOneRowPerPage() {
        progressService.sendMetadata(List.of(
                new ScanMetadata(Path.of("scans", "left-sheet.png"), 0.1234, 0, 0, 800, 1200),
                new ScanMetadata(Path.of("scans", "right-sheet.png"), -0.5, 512, -7, 790, 1190)));

        String[] lines = console.toString(StandardCharsets.UTF_8).split("\\R");
        assertThat(lines).hasSize(4);
        assertThat(lines[0]).startsWith("File").contains("Rotation").contains("Translate X").contains("Translate Y");
        assertThat(lines[1]).matches("-+");
        assertThat(lines[2]).startsWith("left-sheet.png").contains("0.1234");
        assertThat(lines[3]).startsWith("right-sheet.png").contains("-0.5000").contains("512").contains("-7");
    }

    @Test
    void rotationMessageNamesPage() {
        progressService.sendRotationDetected("sheet.png", 0.25);

        assertThat(console.toString(StandardCharsets.UTF_8)).contains("sheet.png").contains("0.2500");
    }
}
