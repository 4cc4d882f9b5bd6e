package com.example.stitchschemata.service.align;

import com.example.stitchschemata.image.ScanImage;

/**
 * Decides when the iterative rotation refinement may stop.
 */
@FunctionalInterface
public interface ConvergencePolicy {

    /**
     * @param iteration  zero-based iteration that produced {@code outcome}
     * @param correction rotation in degrees the outcome asks for
     */
    boolean isConverged(int iteration, double correction, TrialOutcome outcome);

    /**
     * Stops once the requested correction would not move a single pixel.
     */
    static ConvergencePolicy pixelResolution() {
        return (iteration, correction, outcome) ->
                Math.abs(correction) < ScanImage.rotationEpsilon(outcome.getPageWidth(), outcome.getPageHeight());
    }
}
