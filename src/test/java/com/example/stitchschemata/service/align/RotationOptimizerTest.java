package com.example.stitchschemata.service.align;

import com.example.stitchschemata.SyntheticScans;
import com.example.stitchschemata.TestConfigs;
import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.service.DebugImageWriter;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RotationOptimizerTest {

    @TempDir
    Path tempDir;

    private static ScanImage canvas;

    private RotationOptimizer optimizer;
    private ScanImage previous;

    @BeforeAll
    static void loadOpenCv() {
        nu.pattern.OpenCV.loadLocally();
        canvas = SyntheticScans.texturedCanvas(1300, 1200, 41).toGrayscale();
    }

    @BeforeEach
    void setUp() {
        optimizer = new RotationOptimizer(TestConfigs.smallScans(tempDir).build(), DebugImageWriter.disabled());
        previous = canvas.subImage(0, 0, 800, 1200);
    }

    @Test
    void keepsExactAlignmentOfUnrotatedPages() {
        ScanImage current = canvas.subImage(500, 0, 800, 1200);
        PageAlignment coarse = new PageAlignment(AlignmentDirection.FORWARD, 0.0, 500, 0, 20, 0.99, 800, 1200);

        PageAlignment refined = optimizer.optimize(previous, current, coarse);

        assertThat(refined.getRotation()).isCloseTo(0.0, within(0.1));
        assertThat(refined.getTranslateX()).isEqualTo(500);
        assertThat(refined.getTranslateY()).isZero();
        assertThat(refined.getScore()).isGreaterThan(0.99);
    }

    @Test
    void improvesCoarseRotation() {
        ScanImage current = canvas.subImage(500, 0, 800, 1200).rotate(0.4);
        PageAlignment coarse = new PageAlignment(AlignmentDirection.FORWARD, -0.3, 510, 10, 20, 0.9, 800, 1200);

        PageAlignment refined = optimizer.optimize(previous, current, coarse);

        assertThat(refined.getRotation()).isCloseTo(-0.4, within(0.1));
        assertThat(refined.getScore()).isGreaterThan(optimizer.evaluate(previous, current, coarse, -0.3).getScore());
    }

    @Test
    void largeTileNeedsVerticalOverlap() {
        ScanImage current = canvas.subImage(500, 0, 800, 1200);
        PageAlignment coarse = new PageAlignment(AlignmentDirection.FORWARD, 0.0, 500, 1150, 20, 0.9, 800, 1200);

        assertThat(optimizer.evaluate(previous, current, coarse, 0.0).getScore()).isEqualTo(-1.0);
        assertThat(optimizer.optimize(previous, current, coarse)).isSameAs(coarse);
    }

    @Test
    void reverseDirectionSearchesCurrentPage() {
        ScanImage current = canvas.subImage(500, 0, 800, 1200);
        PageAlignment coarse = new PageAlignment(AlignmentDirection.REVERSE, 0.0, 500, 0, 680, 0.95, 800, 1200);

        PageAlignment evaluated = optimizer.evaluate(previous, current, coarse, 0.0);

        assertThat(evaluated.getTranslateX()).isEqualTo(500);
        assertThat(evaluated.getTranslateY()).isZero();
        assertThat(evaluated.getScore()).isGreaterThan(0.99);
    }
}
