package com.example.stitchschemata.model;

/**
 * Bare tile positions for tests outside the model package.
 */
public final class TestTiles {

    private TestTiles() {
    }

    public static Tile at(int x, int y, int width, int height) {
        return Tile.at(x, y, width, height);
    }
}
