package com.example.stitchschemata.service.align;

import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.model.TemplateMatch;
import com.example.stitchschemata.model.Tile;
import com.example.stitchschemata.service.DebugImageWriter;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Locates a tile inside a neighbouring page within the allowed vertical offset.
 */
@Slf4j
public class TileFinder {

    private final StitchConfig config;
    private final DebugImageWriter debug;

    public TileFinder(StitchConfig config, DebugImageWriter debug) {
        this.config = config;
        this.debug = debug;
    }

    public Tile findTile(ScanImage page, Tile tile) {
        return findTile(page, tile, 0, page.getWidth());
    }

    /**
     * Searches rows {@code [tile.y - vmax, tile.y + tile.height + vmax]} and
     * columns {@code [xMin, xMax)}, both clipped to the page. The result carries
     * absolute page coordinates; a search area smaller than the tile yields a
     * score of -1.
     */
    public Tile findTile(ScanImage page, Tile tile, int xMin, int xMax) {
        int vOff = config.getVerticalOffsetMax();
        int x0 = Math.max(0, xMin);
        int x1 = Math.min(page.getWidth(), xMax);
        int y0 = Math.max(0, tile.getY() - vOff);
        int y1 = Math.min(page.getHeight(), tile.getY() + tile.getHeight() + vOff);
        Rect area = new Rect(x0, y0, Math.max(0, x1 - x0), Math.max(0, y1 - y0));

        if (area.width < tile.getWidth() || area.height < tile.getHeight()) {
            log.debug("Search area {} smaller than tile {}x{}", area, tile.getWidth(), tile.getHeight());
            return Tile.unmatched(x0, y0, tile.getWidth(), tile.getHeight(), area);
        }

        TemplateMatch match = page.region(area).matchTemplate(tile.getImage());
        int x = x0 + match.getX();
        int y = y0 + match.getY();
        ScanImage found = page.subImage(x, y, tile.getWidth(), tile.getHeight());
        log.debug("Tile ({}, {}) found at ({}, {}) score {}",
                tile.getX(), tile.getY(), x, y, String.format("%.4f", match.getScore()));

        if (debug.isEnabled()) {
            ScanImage marked = page.region(area).toGrayscale();
            Imgproc.rectangle(marked.getData(), new Rect(match.getX(), match.getY(), tile.getWidth(), tile.getHeight()),
                    new Scalar(0), 3);
            debug.write("search-area", marked);
            debug.write("found", found);
        }
        return Tile.matched(x, y, match.getScore(), found, area);
    }
}
