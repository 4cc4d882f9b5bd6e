package com.example.stitchschemata.service.align;

import com.example.stitchschemata.model.TilePair;
import lombok.Getter;

/**
 * Tiles extracted and matched at one trial angle, plus the size of the current
 * page at that angle.
 */
@Getter
public class TrialOutcome {
    private final TilePair extracted;
    private final TilePair matched;
    private final int pageWidth;
    private final int pageHeight;

    public TrialOutcome(TilePair extracted, TilePair matched, int pageWidth, int pageHeight) {
        this.extracted = extracted;
        this.matched = matched;
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
    }

    /**
     * Matched baseline angle minus extracted baseline angle, in radians.
     */
    public double angleDelta() {
        return matched.baselineAngle() - extracted.baselineAngle();
    }

    public double matchScore() {
        return Math.min(matched.getTop().matchScoreOrZero(), matched.getBottom().matchScoreOrZero());
    }
}
