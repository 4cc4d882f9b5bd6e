package com.example.stitchschemata.model;

import com.example.stitchschemata.image.ScanImage;
import lombok.Getter;
import org.opencv.core.Rect;

/**
 * A rectangular patch of a page.
 *
 * <p>Extracted tiles carry a texture score, found tiles carry a match score and
 * the area of the page that was searched. Coordinates are always absolute page
 * coordinates of the top-left corner.
 */
@Getter
public class Tile {
    private final int x;
    private final int y;
    private final int width;
    private final int height;
    private final Double textureScore;
    private final Double matchScore;
    /** Pixels of the patch; null for a failed search that had nothing to compare. */
    private final ScanImage image;
    private final Rect searchArea;

    private Tile(int x, int y, int width, int height, Double textureScore, Double matchScore,
                 ScanImage image, Rect searchArea) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
        this.textureScore = textureScore;
        this.matchScore = matchScore;
        this.image = image;
        this.searchArea = searchArea;
    }

    public static Tile extracted(int x, int y, double textureScore, ScanImage image) {
        return new Tile(x, y, image.getWidth(), image.getHeight(), textureScore, null, image, null);
    }

    public static Tile matched(int x, int y, double matchScore, ScanImage image, Rect searchArea) {
        return new Tile(x, y, image.getWidth(), image.getHeight(), null, matchScore, image, searchArea);
    }

    /**
     * A search that could not compare anything; the score is -1.
     */
    public static Tile unmatched(int x, int y, int width, int height, Rect searchArea) {
        return new Tile(x, y, width, height, null, -1.0, null, searchArea);
    }

    /**
     * Bare position, used where only the geometry matters.
     */
    static Tile at(int x, int y, int width, int height) {
        return new Tile(x, y, width, height, null, null, null, null);
    }

    public double matchScoreOrZero() {
        return matchScore == null ? 0.0 : matchScore;
    }

    @Override
    public String toString() {
        return String.format("Tile[x=%d, y=%d, %dx%d, texture=%s, match=%s]",
                x, y, width, height, textureScore,
                matchScore == null ? null : String.format("%.4f", matchScore));
    }
}
