package com.example.stitchschemata.image;

/**
 * How much structure a candidate tile carries.
 */
public enum TextureMeasure {

    /** Number of distinct contours after blur and edge detection. */
    SHAPES {
        @Override
        public double score(ScanImage tile, int kernelSize) {
            return tile.numberOfShapes(kernelSize);
        }
    },

    /** Pixel standard deviation. */
    CONTRAST {
        @Override
        public double score(ScanImage tile, int kernelSize) {
            return tile.contrast();
        }
    };

    public abstract double score(ScanImage tile, int kernelSize);
}
