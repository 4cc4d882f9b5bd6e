package com.example.stitchschemata.service.align;

import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.model.Tile;
import com.example.stitchschemata.service.DebugImageWriter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;

/**
 * Refines a coarse page rotation by maximising the correlation of one large
 * tile (tile width by most of the page height) over the allowed rotation range.
 *
 * <p>The coarse result is kept whenever the optimum does not beat it.
 */
@Slf4j
public class RotationOptimizer {

    private static final int MAX_EVALUATIONS = 100;
    private static final double RELATIVE_TOLERANCE = 1e-10;

    private final StitchConfig config;
    private final TileExtractor extractor;
    private final TileFinder finder;
    private final DebugImageWriter debug;

    public RotationOptimizer(StitchConfig config, DebugImageWriter debug) {
        this.config = config;
        this.debug = debug;
        // evaluations run dozens of times per page; only the final match is written
        this.extractor = new TileExtractor(config, DebugImageWriter.disabled());
        this.finder = new TileFinder(config, DebugImageWriter.disabled());
    }

    public PageAlignment optimize(ScanImage previous, ScanImage current, PageAlignment coarse) {
        double rotationMax = config.getRotationMax();
        double tolerance = Math.toDegrees(Math.atan2(1, Math.max(current.getWidth(), current.getHeight())));
        double start = Math.max(-rotationMax, Math.min(rotationMax, coarse.getRotation()));

        PageAlignment baseline = evaluate(previous, current, coarse, coarse.getRotation());
        PageAlignment optimum;
        try {
            BrentOptimizer optimizer = new BrentOptimizer(RELATIVE_TOLERANCE, tolerance);
            UnivariatePointValuePair point = optimizer.optimize(
                    new MaxEval(MAX_EVALUATIONS),
                    new UnivariateObjectiveFunction(angle -> 1.0 - evaluate(previous, current, coarse, angle).getScore()),
                    GoalType.MINIMIZE,
                    new SearchInterval(-rotationMax, rotationMax, start));
            optimum = evaluate(previous, current, coarse, point.getPoint());
            log.debug("Rotation search converged after {} evaluations: {}", optimizer.getEvaluations(), optimum);
        } catch (TooManyEvaluationsException e) {
            log.warn("Rotation search exceeded {} evaluations, keeping {}°",
                    MAX_EVALUATIONS, String.format("%.4f", coarse.getRotation()));
            optimum = baseline;
        }

        PageAlignment best = optimum.getScore() > baseline.getScore() ? optimum : baseline;
        if (best.getScore() < 0) {
            log.debug("Large tile could not be compared, keeping {}", coarse);
            return coarse;
        }
        writeDebug(previous, current, best);
        log.debug("Coarse {} refined to {}", coarse, best);
        return best;
    }

    /**
     * Matches the large tile with the current page rotated by {@code angle}.
     * The score is -1 when the pages overlap too little vertically for a tile.
     */
    PageAlignment evaluate(ScanImage previous, ScanImage currentGray, PageAlignment coarse, double angle) {
        AlignmentDirection direction = coarse.getDirection();
        ScanImage current = currentGray.rotate(angle);
        ScanImage extraction = direction.extractionPage(previous, current);
        ScanImage search = direction.searchPage(previous, current);

        Tile strip = largeTile(extraction, search, coarse);
        if (strip == null) {
            return new PageAlignment(direction, angle, coarse.getTranslateX(), coarse.getTranslateY(),
                    coarse.getTileX(), -1.0, current.getWidth(), current.getHeight());
        }

        int vOff = config.getVerticalOffsetMax();
        int expectedX = strip.getX() + direction.expectedShift(coarse.getTranslateX());
        Tile match = finder.findTile(search, strip, expectedX - vOff, expectedX + strip.getWidth() + vOff);

        int tx = direction.translation(strip.getX(), match.getX());
        int ty = direction.translation(strip.getY(), match.getY());
        log.trace("Angle {}°: score {}", String.format("%.4f", angle), String.format("%.4f", match.matchScoreOrZero()));
        return new PageAlignment(direction, angle, tx, ty, strip.getX(), match.matchScoreOrZero(),
                current.getWidth(), current.getHeight());
    }

    /**
     * Strip at the coarse tile column whose rows stay inside both pages after the
     * coarse vertical shift, leaving the margin free.
     */
    private Tile largeTile(ScanImage extraction, ScanImage search, PageAlignment coarse) {
        int margin = config.getMargin();
        int shiftY = coarse.getDirection().expectedShift(coarse.getTranslateY());
        int yTop = Math.max(margin, margin - shiftY);
        int yBottom = Math.min(extraction.getHeight() - margin, search.getHeight() - margin - shiftY);
        if (yBottom - yTop < config.getTileHeight()) {
            return null;
        }
        int x = Math.max(0, Math.min(coarse.getTileX(), extraction.getWidth() - config.getTileWidth()));
        return extractor.extractLargeTile(extraction, x, yTop, yBottom);
    }

    private void writeDebug(ScanImage previous, ScanImage currentGray, PageAlignment best) {
        if (!debug.isEnabled()) {
            return;
        }
        ScanImage current = currentGray.rotate(best.getRotation());
        ScanImage extraction = best.getDirection().extractionPage(previous, current);
        Tile strip = largeTile(extraction, best.getDirection().searchPage(previous, current), best);
        if (strip != null) {
            debug.write("large-tile", strip.getImage());
        }
    }
}
