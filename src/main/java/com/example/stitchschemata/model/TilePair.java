package com.example.stitchschemata.model;

import lombok.Getter;

/**
 * The top and bottom tile of one page edge; top.y never exceeds bottom.y.
 */
@Getter
public class TilePair {
    private final Tile top;
    private final Tile bottom;

    public TilePair(Tile top, Tile bottom) {
        this.top = top;
        this.bottom = bottom;
    }

    /**
     * Builds a pair, swapping the tiles when needed so the upper one comes first.
     */
    public static TilePair ordered(Tile a, Tile b) {
        return a.getY() <= b.getY() ? new TilePair(a, b) : new TilePair(b, a);
    }

    /**
     * Angle in radians of the line from the top tile to the bottom tile.
     */
    public double baselineAngle() {
        return Math.atan2(bottom.getY() - top.getY(), bottom.getX() - top.getX());
    }

    double distance() {
        return Math.hypot(bottom.getX() - top.getX(), bottom.getY() - top.getY());
    }
}
