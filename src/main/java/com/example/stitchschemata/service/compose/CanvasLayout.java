package com.example.stitchschemata.service.compose;

import com.example.stitchschemata.model.ScanMetadata;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Absolute page positions on the canvas, derived from the chain of relative
 * translations. Offsets are shifted so that no page starts above or left of the
 * canvas origin.
 */
@Getter
public class CanvasLayout {
    private final List<int[]> offsets;
    private final int width;
    private final int height;
    /** First row covered by every page. */
    private final int cropTop;
    /** Row after the last row covered by every page. */
    private final int cropBottom;

    private CanvasLayout(List<int[]> offsets, int width, int height, int cropTop, int cropBottom) {
        this.offsets = Collections.unmodifiableList(offsets);
        this.width = width;
        this.height = height;
        this.cropTop = cropTop;
        this.cropBottom = cropBottom;
    }

    public static CanvasLayout of(List<ScanMetadata> pages) {
        List<int[]> offsets = new ArrayList<>();
        int x = 0;
        int y = 0;
        int minX = 0;
        int minY = 0;
        for (ScanMetadata page : pages) {
            x += page.getTranslateX();
            y += page.getTranslateY();
            offsets.add(new int[]{x, y});
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
        }

        int width = 0;
        int height = 0;
        int cropTop = Integer.MIN_VALUE;
        int cropBottom = Integer.MAX_VALUE;
        for (int i = 0; i < pages.size(); i++) {
            int[] offset = offsets.get(i);
            offset[0] -= minX;
            offset[1] -= minY;
            ScanMetadata page = pages.get(i);
            width = Math.max(width, offset[0] + page.getWidth());
            height = Math.max(height, offset[1] + page.getHeight());
            cropTop = Math.max(cropTop, offset[1]);
            cropBottom = Math.min(cropBottom, offset[1] + page.getHeight());
        }
        return new CanvasLayout(offsets, width, height, cropTop, cropBottom);
    }

    public int offsetX(int page) {
        return offsets.get(page)[0];
    }

    public int offsetY(int page) {
        return offsets.get(page)[1];
    }

    /**
     * Whether all pages share at least one row.
     */
    public boolean hasCommonSpan() {
        return cropBottom > cropTop;
    }
}
