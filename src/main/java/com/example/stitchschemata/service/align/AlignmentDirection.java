package com.example.stitchschemata.service.align;

import com.example.stitchschemata.image.ScanImage;
import com.example.stitchschemata.model.Side;

import java.util.Optional;

/**
 * Which page of a neighbouring pair tiles are cut from and which one they are
 * searched in.
 *
 * <p>FORWARD cuts from the leading edge of the current page and searches the
 * previous page. REVERSE cuts from the trailing edge of the previous page and
 * searches the current one; it is the fallback when the current page's leading
 * edge carries too little texture. The two variants differ in the sign of the
 * rotation correction and the direction of the measured translation.
 */
public enum AlignmentDirection {

    FORWARD(Side.LEFT, true) {
        @Override
        public ScanImage extractionPage(ScanImage previous, ScanImage current) {
            return current;
        }

        @Override
        public ScanImage searchPage(ScanImage previous, ScanImage current) {
            return previous;
        }

        @Override
        public double correction(double angleDelta) {
            return -Math.toDegrees(angleDelta);
        }

        @Override
        public int translation(int extracted, int matched) {
            return matched - extracted;
        }

        @Override
        public int expectedShift(int translation) {
            return translation;
        }

        @Override
        public Optional<AlignmentDirection> fallback() {
            return Optional.of(REVERSE);
        }
    },

    REVERSE(Side.RIGHT, false) {
        @Override
        public ScanImage extractionPage(ScanImage previous, ScanImage current) {
            return previous;
        }

        @Override
        public ScanImage searchPage(ScanImage previous, ScanImage current) {
            return current;
        }

        @Override
        public double correction(double angleDelta) {
            return Math.toDegrees(angleDelta);
        }

        @Override
        public int translation(int extracted, int matched) {
            return extracted - matched;
        }

        @Override
        public int expectedShift(int translation) {
            return -translation;
        }

        @Override
        public Optional<AlignmentDirection> fallback() {
            return Optional.empty();
        }
    };

    private final Side side;
    private final boolean usesHints;

    AlignmentDirection(Side side, boolean usesHints) {
        this.side = side;
        this.usesHints = usesHints;
    }

    /** Band of the extraction page tiles are cut from. */
    public Side getSide() {
        return side;
    }

    /** Tile hints describe the current page's leading edge, so only FORWARD honours them. */
    public boolean usesHints() {
        return usesHints;
    }

    public abstract ScanImage extractionPage(ScanImage previous, ScanImage current);

    public abstract ScanImage searchPage(ScanImage previous, ScanImage current);

    /**
     * Rotation in degrees to add to the current page's angle, given the difference
     * in radians between the matched and the extracted baseline.
     */
    public abstract double correction(double angleDelta);

    /**
     * Translation of the current page relative to the previous one along one axis.
     */
    public abstract int translation(int extracted, int matched);

    /**
     * Offset from an extraction coordinate to where it is expected in the search
     * page, for a known translation.
     */
    public abstract int expectedShift(int translation);

    /** The direction to try when this one fails, if any. */
    public abstract Optional<AlignmentDirection> fallback();
}
