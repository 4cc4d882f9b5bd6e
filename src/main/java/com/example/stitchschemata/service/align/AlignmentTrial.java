package com.example.stitchschemata.service.align;

/**
 * Rotates the current page to a trial angle, extracts tiles and matches them.
 * Throws {@link com.example.stitchschemata.exception.AlignmentFailedException}
 * when no usable tiles or matches exist.
 */
@FunctionalInterface
public interface AlignmentTrial {
    TrialOutcome attempt(double angle);
}
