package com.example.stitchschemata.service.align;

import com.example.stitchschemata.image.ScanImage;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Estimates the skew of a page from its long dark straight lines (frame and
 * circuit wiring of a schematic).
 */
@Slf4j
public class OrientationDetector {

    private static final double DARK_MAX = 110;
    private static final double LINE_LENGTH_FRACTION = 0.1;

    private final double rotationMax;

    public OrientationDetector(double rotationMax) {
        this.rotationMax = rotationMax;
    }

    /**
     * Mean deviation in degrees of near-horizontal and near-vertical segments from
     * the axes, or empty if no qualifying segment exists. Rotating the page by the
     * result straightens it.
     */
    public OptionalDouble detectOrientation(ScanImage grayscale) {
        Mat dark = new Mat();
        Mat edges = new Mat();
        Mat lines = new Mat();
        try {
            Core.inRange(grayscale.getData(), new Scalar(0), new Scalar(DARK_MAX), dark);
            Imgproc.Canny(dark, edges, 150, 150);
            Imgproc.HoughLinesP(edges, lines, 1, Math.PI / 1800, 100, 100, 25);

            double lengthMin = LINE_LENGTH_FRACTION * Math.max(grayscale.getWidth(), grayscale.getHeight());
            List<Double> angles = new ArrayList<>();

            for (int i = 0; i < lines.rows(); i++) {
                double[] l = lines.get(i, 0);
                double dx = l[2] - l[0];
                double dy = l[3] - l[1];
                if (Math.hypot(dx, dy) <= lengthMin) {
                    continue;
                }
                double angle = normalizeAngle(Math.toDegrees(Math.atan2(dy, dx)));
                if (Math.abs(angle) < rotationMax) {
                    angles.add(angle);
                }
            }

            if (angles.isEmpty()) {
                log.debug("No qualifying line segments among {} candidates", lines.rows());
                return OptionalDouble.empty();
            }
            double mean = angles.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            log.debug("Orientation from {} segments: {}°", angles.size(), String.format("%.4f", mean));
            return OptionalDouble.of(mean);
        } finally {
            dark.release();
            edges.release();
            lines.release();
        }
    }

    /**
     * Folds an angle into [-45°, 45°] so vertical lines count like horizontal ones.
     */
    static double normalizeAngle(double angle) {
        while (angle > 45) angle -= 90;
        while (angle < -45) angle += 90;
        return angle;
    }
}
