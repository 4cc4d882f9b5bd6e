package com.example.stitchschemata.service.align;

import com.example.stitchschemata.exception.RotationExceededException;
import lombok.extern.slf4j.Slf4j;

/**
 * Iteratively corrects a page's rotation from the angle between the extracted
 * and the matched tile baselines.
 *
 * <p>Every iteration re-rotates the unrotated page by the accumulated angle and
 * runs a fresh trial. The loop stops when the policy reports convergence or the
 * iteration cap is hit; the alignment of the last trial is returned.
 */
@Slf4j
public class RotationRefinement {

    private final double rotationMax;
    private final int iterationsMax;
    private final ConvergencePolicy policy;

    public RotationRefinement(double rotationMax, int iterationsMax, ConvergencePolicy policy) {
        if (iterationsMax < 1) {
            throw new IllegalArgumentException("iterationsMax must be at least 1");
        }
        this.rotationMax = rotationMax;
        this.iterationsMax = iterationsMax;
        this.policy = policy;
    }

    /**
     * @throws RotationExceededException if the accumulated angle leaves the allowed range
     * @throws com.example.stitchschemata.exception.AlignmentFailedException from the trial
     */
    public PageAlignment refine(AlignmentDirection direction, AlignmentTrial trial) {
        double angle = 0.0;
        for (int iteration = 0; ; iteration++) {
            TrialOutcome outcome = trial.attempt(angle);
            double correction = direction.correction(outcome.angleDelta());
            log.debug("{} iteration {}: angle {}°, correction {}°, score {}", direction, iteration,
                    String.format("%.4f", angle), String.format("%.4f", correction),
                    String.format("%.4f", outcome.matchScore()));

            if (iteration >= iterationsMax - 1 || policy.isConverged(iteration, correction, outcome)) {
                return PageAlignment.fromTrial(direction, angle, outcome);
            }

            angle += correction;
            if (Math.abs(angle) > rotationMax) {
                throw new RotationExceededException(String.format(
                        "Rotation of %.4f° exceeds the maximum of %.4f°.", angle, rotationMax));
            }
        }
    }
}
