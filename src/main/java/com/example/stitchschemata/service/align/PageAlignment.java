package com.example.stitchschemata.service.align;

import com.example.stitchschemata.model.ScanMetadata;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Rotation and translation of a page against its predecessor, together with
 * the evidence it was derived from.
 */
@Getter
public class PageAlignment {
    private final AlignmentDirection direction;
    private final double rotation;
    private final int translateX;
    private final int translateY;
    /** Column of the (top) extracted tile in the extraction page. */
    private final int tileX;
    private final double score;
    private final int width;
    private final int height;

    public PageAlignment(AlignmentDirection direction, double rotation, int translateX, int translateY,
                         int tileX, double score, int width, int height) {
        this.direction = direction;
        this.rotation = rotation;
        this.translateX = translateX;
        this.translateY = translateY;
        this.tileX = tileX;
        this.score = score;
        this.width = width;
        this.height = height;
    }

    static PageAlignment fromTrial(AlignmentDirection direction, double rotation, TrialOutcome outcome) {
        int tx = direction.translation(outcome.getExtracted().getTop().getX(), outcome.getMatched().getTop().getX());
        int ty = direction.translation(outcome.getExtracted().getTop().getY(), outcome.getMatched().getTop().getY());
        return new PageAlignment(direction, rotation, tx, ty, outcome.getExtracted().getTop().getX(),
                outcome.matchScore(), outcome.getPageWidth(), outcome.getPageHeight());
    }

    public ScanMetadata toMetadata(Path path) {
        return new ScanMetadata(path, rotation, translateX, translateY, width, height);
    }

    @Override
    public String toString() {
        return String.format("PageAlignment[%s, rotation=%.4f, translate=(%d, %d), score=%.4f]",
                direction, rotation, translateX, translateY, score);
    }
}
