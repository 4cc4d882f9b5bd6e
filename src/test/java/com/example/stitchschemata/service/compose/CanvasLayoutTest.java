package com.example.stitchschemata.service.compose;

import com.example.stitchschemata.model.ScanMetadata;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CanvasLayoutTest {

    @Test
    void offsetsAccumulateRelativeTranslations() {
        CanvasLayout layout = CanvasLayout.of(List.of(
                page(0, 0, 800, 1200),
                page(500, 30, 800, 1200),
                page(500, 30, 800, 1200)));

        assertThat(layout.offsetX(1)).isEqualTo(500);
        assertThat(layout.offsetX(2)).isEqualTo(1000);
        assertThat(layout.offsetY(2)).isEqualTo(60);
        assertThat(layout.getWidth()).isEqualTo(1800);
        assertThat(layout.getHeight()).isEqualTo(1260);
        assertThat(layout.getCropTop()).isEqualTo(60);
        assertThat(layout.getCropBottom()).isEqualTo(1200);
        assertThat(layout.hasCommonSpan()).isTrue();
    }

    @Test
    void negativeOffsetsAreShiftedOntoCanvas() {
        CanvasLayout layout = CanvasLayout.of(List.of(
                page(0, 0, 800, 1200),
                page(500, -40, 790, 1190)));

        assertThat(layout.offsetY(0)).isEqualTo(40);
        assertThat(layout.offsetY(1)).isZero();
        assertThat(layout.getHeight()).isEqualTo(1240);
        assertThat(layout.getWidth()).isEqualTo(1290);
        assertThat(layout.getCropTop()).isEqualTo(40);
        assertThat(layout.getCropBottom()).isEqualTo(1190);
    }

    @Test
    void pagesWithoutSharedRowsHaveNoCommonSpan() {
        CanvasLayout layout = CanvasLayout.of(List.of(
                page(0, 0, 800, 400),
                page(500, 500, 800, 400)));

        assertThat(layout.hasCommonSpan()).isFalse();
    }

    @Test
    void singlePageFillsCanvas() {
        CanvasLayout layout = CanvasLayout.of(List.of(page(0, 0, 640, 480)));

        assertThat(layout.getWidth()).isEqualTo(640);
        assertThat(layout.getHeight()).isEqualTo(480);
        assertThat(layout.getCropTop()).isZero();
        assertThat(layout.getCropBottom()).isEqualTo(480);
    }

    private static ScanMetadata page(int tx, int ty, int width, int height) {
        return new ScanMetadata(Path.of("page.png"), 0.0, tx, ty, width, height);
    }
}
