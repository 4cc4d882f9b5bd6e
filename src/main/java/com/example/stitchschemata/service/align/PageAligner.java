package com.example.stitchschemata.service.align;

import com.example.stitchschemata.exception.AlignmentFailedException;
import com.example.stitchschemata.exception.MatchBelowThresholdException;
import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.model.Tile;
import com.example.stitchschemata.model.TileHint;
import com.example.stitchschemata.model.TilePair;
import com.example.stitchschemata.service.DebugImageWriter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Aligns a page to its predecessor: iterative tile-pair refinement, forward
 * first and reverse on failure, followed by the large-tile rotation search.
 */
@Slf4j
public class PageAligner {

    private final StitchConfig config;
    private final TileExtractor extractor;
    private final TileFinder finder;
    private final RotationRefinement refinement;
    private final RotationOptimizer optimizer;

    public PageAligner(StitchConfig config, DebugImageWriter debug) {
        this(config,
                new TileExtractor(config, debug),
                new TileFinder(config, debug),
                new RotationRefinement(config.getRotationMax(), config.getTileIterationsMax(),
                        ConvergencePolicy.pixelResolution()),
                new RotationOptimizer(config, debug));
    }

    PageAligner(StitchConfig config, TileExtractor extractor, TileFinder finder,
                RotationRefinement refinement, RotationOptimizer optimizer) {
        this.config = config;
        this.extractor = extractor;
        this.finder = finder;
        this.refinement = refinement;
        this.optimizer = optimizer;
    }

    /**
     * @param previous grayscale predecessor, already rotated into place
     * @param current  grayscale page, unrotated
     * @param hint     manual tiles for the current page's leading edge, or null
     * @throws StitchException if neither direction yields an alignment
     */
    public PageAlignment align(ScanImage previous, ScanImage current, TileHint hint) {
        PageAlignment coarse = refineWithFallback(previous, current, hint);
        log.info("Coarse alignment: {}", coarse);
        PageAlignment refined = optimizer.optimize(previous, current, coarse);
        log.info("Refined alignment: {}", refined);
        return refined;
    }

    PageAlignment refineWithFallback(ScanImage previous, ScanImage current, TileHint hint) {
        Optional<AlignmentDirection> next = Optional.of(AlignmentDirection.FORWARD);
        AlignmentFailedException failure = null;
        while (next.isPresent()) {
            AlignmentDirection direction = next.get();
            try {
                return refinement.refine(direction, trial(direction, previous, current, hint));
            } catch (AlignmentFailedException e) {
                log.info("{} alignment failed: {}", direction, e.getMessage());
                failure = e;
                next = direction.fallback();
            }
        }
        throw new StitchException("Unable to align page in either direction: " + failure.getMessage(), failure);
    }

    AlignmentTrial trial(AlignmentDirection direction, ScanImage previous, ScanImage currentGray, TileHint hint) {
        return angle -> {
            ScanImage current = currentGray.rotate(angle);
            ScanImage extraction = direction.extractionPage(previous, current);
            ScanImage search = direction.searchPage(previous, current);

            TilePair extracted = extractor.extractTiles(extraction, direction.getSide(),
                    direction.usesHints() ? hint : null);
            Tile top = requireMatch(finder.findTile(search, extracted.getTop()), "top");
            Tile bottom = requireMatch(finder.findTile(search, extracted.getBottom()), "bottom");
            return new TrialOutcome(extracted, new TilePair(top, bottom), current.getWidth(), current.getHeight());
        };
    }

    private Tile requireMatch(Tile match, String which) {
        if (match.matchScoreOrZero() < config.getTileMatchMin()) {
            throw new MatchBelowThresholdException(String.format(
                    "The %s tile matched with %.4f, below the minimum of %.4f.",
                    which, match.matchScoreOrZero(), config.getTileMatchMin()));
        }
        return match;
    }
}
