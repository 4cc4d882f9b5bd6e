package com.example.stitchschemata.service.align;

import com.example.stitchschemata.exception.TileSearchExhaustedException;
import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.image.TextureMeasure;
import com.example.stitchschemata.model.Side;
import com.example.stitchschemata.model.StitchConfig;
import com.example.stitchschemata.model.Tile;
import com.example.stitchschemata.model.TileHint;
import com.example.stitchschemata.model.TilePair;
import com.example.stitchschemata.service.DebugImageWriter;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Rect;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks two well-textured, far-apart tiles from one vertical band of a page.
 *
 * <p>Automatic mode scores a half-tile grid inside the band and keeps candidates
 * reaching the texture minimum. Of all pairs further apart than the tile
 * diagonal, the pair maximising normalized combined texture plus normalized
 * distance wins; pairs are compared in scan order with a strict {@code >}, so the
 * result is deterministic.
 */
@Slf4j
public class TileExtractor {

    private final StitchConfig config;
    private final DebugImageWriter debug;

    public TileExtractor(StitchConfig config, DebugImageWriter debug) {
        this.config = config;
        this.debug = debug;
    }

    /**
     * @param hint manual tile centres, or null for automatic search
     * @throws TileSearchExhaustedException if no pair qualifies
     */
    public TilePair extractTiles(ScanImage page, Side side, TileHint hint) {
        TilePair pair = hint != null ? extractHinted(page, hint) : extractAutomatic(page, side);
        log.debug("Extracted {} tiles: top={}, bottom={}", side, pair.getTop(), pair.getBottom());
        debug.write("extracted-top", pair.getTop().getImage());
        debug.write("extracted-bottom", pair.getBottom().getImage());
        return pair;
    }

    // ==================== Manual mode ====================

    private TilePair extractHinted(ScanImage page, TileHint hint) {
        Tile a = tileAround(page, hint.getTopX(), hint.getTopY());
        Tile b = tileAround(page, hint.getBottomX(), hint.getBottomY());
        return TilePair.ordered(a, b);
    }

    private Tile tileAround(ScanImage page, int centerX, int centerY) {
        int x0 = clamp(centerX - config.getTileWidth() / 2, 0, page.getWidth() - 1);
        int y0 = clamp(centerY - config.getTileHeight() / 2, 0, page.getHeight() - 1);
        int x1 = clamp(x0 + config.getTileWidth(), x0 + 1, page.getWidth());
        int y1 = clamp(y0 + config.getTileHeight(), y0 + 1, page.getHeight());

        ScanImage image = page.subImage(x0, y0, x1 - x0, y1 - y0);
        double score = config.getTextureMeasure().score(image, config.kernelSize());
        return Tile.extracted(x0, y0, score, image);
    }

    // ==================== Automatic mode ====================

    private TilePair extractAutomatic(ScanImage page, Side side) {
        List<Candidate> candidates = scoreCandidates(page, side);
        if (candidates.size() < 2) {
            throw new TileSearchExhaustedException(String.format(
                    "Found %d tile(s) with at least %.1f texture in the %s band, need 2.",
                    candidates.size(), config.getTileShapesMin(), side));
        }

        double diagonal = Math.hypot(config.getTileWidth(), config.getTileHeight());
        double maxPairScore = 0.0;
        double maxDistance = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                double distance = candidates.get(i).distanceTo(candidates.get(j));
                if (distance > diagonal) {
                    maxPairScore = Math.max(maxPairScore, candidates.get(i).score + candidates.get(j).score);
                    maxDistance = Math.max(maxDistance, distance);
                }
            }
        }
        if (maxDistance == 0.0) {
            throw new TileSearchExhaustedException(String.format(
                    "No two textured tiles in the %s band are further apart than %.1f pixels.", side, diagonal));
        }

        Candidate bestA = null;
        Candidate bestB = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                Candidate a = candidates.get(i);
                Candidate b = candidates.get(j);
                double distance = a.distanceTo(b);
                if (distance <= diagonal) {
                    continue;
                }
                double texture = maxPairScore > 0 ? (a.score + b.score) / maxPairScore : 0.0;
                double value = texture + distance / maxDistance;
                if (value > bestValue) {
                    bestValue = value;
                    bestA = a;
                    bestB = b;
                }
            }
        }

        return TilePair.ordered(toTile(page, bestA), toTile(page, bestB));
    }

    private List<Candidate> scoreCandidates(ScanImage page, Side side) {
        int tw = config.getTileWidth();
        int th = config.getTileHeight();
        int w = page.getWidth();
        int h = page.getHeight();
        int band = (int) (config.getOverlapMin() * w);

        int xMin;
        int xMax;
        if (side == Side.LEFT) {
            xMin = config.getMargin();
            xMax = Math.max(xMin, band - tw);
        } else {
            xMin = w - band;
            xMax = Math.max(xMin, w - config.getMargin() - tw);
        }
        xMin = Math.max(0, xMin);
        xMax = Math.min(xMax, w - tw);
        int yMin = config.getMargin();
        int yMax = h - config.getMargin() - th;

        int stepX = Math.max(1, tw / 2);
        int stepY = Math.max(1, th / 2);
        TextureMeasure measure = config.getTextureMeasure();
        int kernelSize = config.kernelSize();

        List<Candidate> candidates = new ArrayList<>();
        int sampled = 0;
        for (int y = yMin; y <= yMax; y += stepY) {
            for (int x = xMin; x <= xMax; x += stepX) {
                ScanImage view = page.region(new Rect(x, y, tw, th));
                double score = measure.score(view, kernelSize);
                sampled++;
                log.trace("Candidate ({}, {}) texture {}", x, y, score);
                if (score >= config.getTileShapesMin()) {
                    candidates.add(new Candidate(x, y, score));
                }
            }
        }
        log.debug("{} band x=[{}, {}]: {} of {} candidates textured", side, xMin, xMax, candidates.size(), sampled);
        return candidates;
    }

    private Tile toTile(ScanImage page, Candidate candidate) {
        ScanImage image = page.subImage(candidate.x, candidate.y, config.getTileWidth(), config.getTileHeight());
        return Tile.extracted(candidate.x, candidate.y, candidate.score, image);
    }

    // ==================== Large tile ====================

    /**
     * A tile-wide strip spanning rows {@code [yTop, yBottom)} at column {@code x},
     * clipped to the page.
     */
    public Tile extractLargeTile(ScanImage page, int x, int yTop, int yBottom) {
        int x0 = clamp(x, 0, page.getWidth() - 1);
        int width = Math.min(config.getTileWidth(), page.getWidth() - x0);
        int y0 = clamp(yTop, 0, page.getHeight() - 1);
        int y1 = clamp(yBottom, y0 + 1, page.getHeight());
        ScanImage image = page.subImage(x0, y0, width, y1 - y0);
        return Tile.extracted(x0, y0, 0.0, image);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static final class Candidate {
        final int x;
        final int y;
        final double score;

        Candidate(int x, int y, double score) {
            this.x = x;
            this.y = y;
            this.score = score;
        }

        double distanceTo(Candidate other) {
            return Math.hypot(other.x - x, other.y - y);
        }
    }
}
