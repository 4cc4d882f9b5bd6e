package com.example.stitchschemata.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TilePairTest {

    @Test
    void orderedPutsUpperTileFirst() {
        Tile lower = Tile.at(10, 900, 80, 80);
        Tile upper = Tile.at(30, 100, 80, 80);

        TilePair pair = TilePair.ordered(lower, upper);

        assertThat(pair.getTop()).isSameAs(upper);
        assertThat(pair.getBottom()).isSameAs(lower);
    }

    @Test
    void baselineOfVerticalPairIsRightAngle() {
        TilePair pair = TilePair.ordered(Tile.at(50, 100, 80, 80), Tile.at(50, 900, 80, 80));

        assertThat(pair.baselineAngle()).isCloseTo(Math.PI / 2, within(1e-12));
        assertThat(pair.distance()).isCloseTo(800.0, within(1e-12));
    }

    @Test
    void baselineLeansWithHorizontalOffset() {
        TilePair pair = TilePair.ordered(Tile.at(0, 0, 80, 80), Tile.at(-10, 1000, 80, 80));

        assertThat(pair.baselineAngle()).isGreaterThan(Math.PI / 2);
    }
}
