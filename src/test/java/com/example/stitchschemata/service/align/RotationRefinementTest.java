package com.example.stitchschemata.service.align;

import com.example.stitchschemata.exception.RotationExceededException;
import com.example.stitchschemata.exception.TileSearchExhaustedException;
import com.example.stitchschemata.model.TestTiles;
import com.example.stitchschemata.model.TilePair;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RotationRefinementTest {

    private static final int BASELINE = 100_000;

    @Test
    void convergesOnTrueRotation() {
        List<Double> attempts = new ArrayList<>();
        RotationRefinement refinement = new RotationRefinement(1.0, 5, ConvergencePolicy.pixelResolution());

        PageAlignment result = refinement.refine(AlignmentDirection.FORWARD, angle -> {
            attempts.add(angle);
            return outcomeRequesting(AlignmentDirection.FORWARD, 0.4 - angle);
        });

        assertThat(result.getRotation()).isCloseTo(0.4, within(1e-3));
        assertThat(attempts).hasSize(2);
        assertThat(attempts.get(0)).isZero();
    }

    @Test
    void reverseDirectionAppliesOppositeSign() {
        RotationRefinement refinement = new RotationRefinement(1.0, 5, ConvergencePolicy.pixelResolution());

        PageAlignment result = refinement.refine(AlignmentDirection.REVERSE,
                angle -> outcomeRequesting(AlignmentDirection.REVERSE, -0.6 - angle));

        assertThat(result.getRotation()).isCloseTo(-0.6, within(1e-3));
        assertThat(result.getDirection()).isEqualTo(AlignmentDirection.REVERSE);
    }

    @Test
    void stopsAtIterationCap() {
        List<Double> attempts = new ArrayList<>();
        RotationRefinement refinement = new RotationRefinement(10.0, 3, ConvergencePolicy.pixelResolution());

        PageAlignment result = refinement.refine(AlignmentDirection.FORWARD, angle -> {
            attempts.add(angle);
            return outcomeRequesting(AlignmentDirection.FORWARD, 0.3);
        });

        assertThat(attempts).hasSize(3);
        assertThat(result.getRotation()).isCloseTo(0.6, within(1e-3));
    }

    @Test
    void singleIterationReturnsFirstTrial() {
        RotationRefinement refinement = new RotationRefinement(1.0, 1, ConvergencePolicy.pixelResolution());

        PageAlignment result = refinement.refine(AlignmentDirection.FORWARD,
                angle -> outcomeRequesting(AlignmentDirection.FORWARD, 0.5));

        assertThat(result.getRotation()).isZero();
    }

    @Test
    void rejectsRotationBeyondLimit() {
        RotationRefinement refinement = new RotationRefinement(1.0, 5, ConvergencePolicy.pixelResolution());

        assertThatThrownBy(() -> refinement.refine(AlignmentDirection.FORWARD,
                angle -> outcomeRequesting(AlignmentDirection.FORWARD, 2.0 - angle)))
                .isInstanceOf(RotationExceededException.class)
                .hasMessageContaining("exceeds the maximum");
    }

    @Test
    void trialFailurePropagates() {
        RotationRefinement refinement = new RotationRefinement(1.0, 5, ConvergencePolicy.pixelResolution());

        assertThatThrownBy(() -> refinement.refine(AlignmentDirection.FORWARD, angle -> {
            throw new TileSearchExhaustedException("no tiles");
        })).isInstanceOf(TileSearchExhaustedException.class);
    }

    @Test
    void customPolicyCanStopEarly() {
        List<Double> attempts = new ArrayList<>();
        RotationRefinement refinement = new RotationRefinement(1.0, 5, (iteration, correction, outcome) -> true);

        refinement.refine(AlignmentDirection.FORWARD, angle -> {
            attempts.add(angle);
            return outcomeRequesting(AlignmentDirection.FORWARD, 0.5);
        });

        assertThat(attempts).containsExactly(0.0);
    }

    @Test
    void translationComesFromTopTiles() {
        RotationRefinement refinement = new RotationRefinement(1.0, 5, ConvergencePolicy.pixelResolution());
        TilePair extracted = new TilePair(TestTiles.at(40, 100, 80, 80), TestTiles.at(40, 900, 80, 80));
        TilePair matched = new TilePair(TestTiles.at(540, 112, 80, 80), TestTiles.at(540, 912, 80, 80));

        PageAlignment result = refinement.refine(AlignmentDirection.FORWARD,
                angle -> new TrialOutcome(extracted, matched, 1000, 1000));

        assertThat(result.getTranslateX()).isEqualTo(500);
        assertThat(result.getTranslateY()).isEqualTo(12);
        assertThat(result.getTileX()).isEqualTo(40);
    }

    /**
     * Outcome whose baselines differ so that {@code direction} asks for the given
     * correction in degrees.
     */
    private static TrialOutcome outcomeRequesting(AlignmentDirection direction, double correctionDegrees) {
        double delta = direction == AlignmentDirection.FORWARD
                ? -Math.toRadians(correctionDegrees)
                : Math.toRadians(correctionDegrees);
        TilePair extracted = new TilePair(TestTiles.at(0, 0, 80, 80), TestTiles.at(0, BASELINE, 80, 80));
        TilePair matched = new TilePair(TestTiles.at(0, 0, 80, 80),
                TestTiles.at((int) Math.round(-BASELINE * Math.sin(delta)), (int) Math.round(BASELINE * Math.cos(delta)), 80, 80));
        return new TrialOutcome(extracted, matched, 1000, 1000);
    }
}
