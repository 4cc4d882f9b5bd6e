package com.example.stitchschemata.image;

import com.example.stitchschemata.exception.ImageDecodeException;
import com.example.stitchschemata.model.OutputFormat;
import com.example.stitchschemata.model.TemplateMatch;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.color.ColorSpace;
import java.awt.color.ICC_ColorSpace;
import java.awt.color.ICC_Profile;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * A raster page backed by an OpenCV {@link Mat}.
 *
 * <p>Transforms return new instances and leave the receiver untouched; the only
 * exception is {@link #mergeInto}, which paints onto a canvas in place.
 * Pixels are stored BGR (three channels) or grayscale (one channel), 8 bit.
 */
public final class ScanImage {

    private final Mat data;

    public ScanImage(Mat data) {
        if (data == null || data.empty()) {
            throw new IllegalArgumentException("Image data must not be empty");
        }
        this.data = data;
    }

    // ==================== I/O ====================

    /**
     * Decodes an image file into a three-channel BGR raster.
     *
     * @throws ImageDecodeException if the file is missing or no decoder accepts it
     */
    public static ScanImage read(Path path) {
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new ImageDecodeException("Unable to open image '" + path + "': " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Unable to decode image '" + path + "'.");
        }
        return fromBufferedImage(image);
    }

    /**
     * Converts any AWT image to a BGR raster by drawing it into a 3-byte buffer.
     */
    public static ScanImage fromBufferedImage(BufferedImage image) {
        BufferedImage converted = new BufferedImage(
                image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);

        Graphics2D g = converted.createGraphics();
        g.drawImage(image, 0, 0, null);
        g.dispose();

        byte[] pixels = ((DataBufferByte) converted.getRaster().getDataBuffer()).getData();

        Mat mat = new Mat(converted.getHeight(), converted.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return new ScanImage(mat);
    }

    public BufferedImage toBufferedImage() {
        int type = data.channels() == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR;
        BufferedImage image = new BufferedImage(data.cols(), data.rows(), type);

        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        Mat continuous = data.isContinuous() ? data : data.clone();
        continuous.get(0, 0, target);
        return image;
    }

    /**
     * Writes the image as PNG.
     */
    public void write(Path path) throws IOException {
        write(path, OutputFormat.PNG, 100);
    }

    /**
     * Writes the image as PNG (lossless) or JPEG with the given quality (1..100).
     */
    public void write(Path path, OutputFormat format, int quality) throws IOException {
        BufferedImage image = toBufferedImage();
        switch (format) {
            case PNG:
                if (!ImageIO.write(image, "png", path.toFile())) {
                    throw new IOException("No PNG writer available");
                }
                break;
            case JPEG:
                writeJpeg(image, path, quality);
                break;
            default:
                throw new IllegalArgumentException("Raster images cannot be written as " + format);
        }
    }

    private static void writeJpeg(BufferedImage image, Path path, int quality) throws IOException {
        ImageWriter writer = ImageIO.getImageWritersByFormatName("jpeg").next();
        ImageWriteParam params = writer.getDefaultWriteParam();
        params.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        params.setCompressionQuality(Math.min(Math.max(quality / 100f, 0.01f), 1.0f));

        try (ImageOutputStream out = ImageIO.createImageOutputStream(path.toFile())) {
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), params);
        } finally {
            writer.dispose();
        }
    }

    /**
     * Reads the embedded ICC profile of an image file without decoding its pixels.
     */
    public static Optional<ICC_Profile> readIccProfile(Path path) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(path.toFile())) {
            if (in == null) {
                return Optional.empty();
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                return Optional.empty();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in);
                Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
                if (types.hasNext()) {
                    ColorSpace colorSpace = types.next().getColorModel().getColorSpace();
                    if (colorSpace instanceof ICC_ColorSpace) {
                        return Optional.of(((ICC_ColorSpace) colorSpace).getProfile());
                    }
                }
                return Optional.empty();
            } finally {
                reader.dispose();
            }
        }
    }

    // ==================== Geometry ====================

    public static ScanImage blank(int width, int height, int channels) {
        return new ScanImage(new Mat(height, width, CvType.CV_8UC(channels), Scalar.all(255)));
    }

    public int getWidth() {
        return data.cols();
    }

    public int getHeight() {
        return data.rows();
    }

    public int getChannels() {
        return data.channels();
    }

    public Size size() {
        return data.size();
    }

    public Mat getData() {
        return data;
    }

    public ScanImage toGrayscale() {
        if (data.channels() == 1) {
            return new ScanImage(data.clone());
        }
        Mat gray = new Mat();
        Imgproc.cvtColor(data, gray, Imgproc.COLOR_BGR2GRAY);
        return new ScanImage(gray);
    }

    /**
     * Copies a rectangular region; the region must lie inside the image.
     */
    public ScanImage subImage(int x, int y, int width, int height) {
        return new ScanImage(data.submat(new Rect(x, y, width, height)).clone());
    }

    /**
     * View of a region sharing pixels with this image. Only for read-only use.
     */
    public ScanImage region(Rect rect) {
        return new ScanImage(data.submat(rect));
    }

    /**
     * Smallest angle in degrees that moves a border pixel of a {@code width x height}
     * image by one pixel when rotating about the centre.
     */
    public static double rotationEpsilon(int width, int height) {
        return Math.toDegrees(Math.atan2(1, Math.max(width, height) / 2));
    }

    public boolean rotationHasEffect(double angle) {
        return Math.abs(angle) >= rotationEpsilon(getWidth(), getHeight());
    }

    /**
     * Rotates about the centre (positive angles counter-clockwise) and crops to the
     * largest axis-aligned rectangle free of padding. Returns this image unchanged
     * if the rotation would not move any pixel.
     */
    public ScanImage rotate(double angle) {
        if (!rotationHasEffect(angle)) {
            return this;
        }
        int w = getWidth();
        int h = getHeight();
        Point center = new Point(w / 2, h / 2);

        Mat rotMat = Imgproc.getRotationMatrix2D(center, angle, 1.0);
        Mat rotated = new Mat();
        Imgproc.warpAffine(data, rotated, rotMat, data.size(), Imgproc.INTER_LINEAR,
                Core.BORDER_CONSTANT, Scalar.all(0));
        rotMat.release();

        double[] inscribed = largestRotatedRect(w, h, Math.toRadians(angle));
        // one pixel inset keeps interpolated border pixels out
        int cropWidth = Math.max(1, Math.min(w, (int) Math.floor(inscribed[0]) - 2));
        int cropHeight = Math.max(1, Math.min(h, (int) Math.floor(inscribed[1]) - 2));
        int x = (w - cropWidth) / 2;
        int y = (h - cropHeight) / 2;

        Mat cropped = rotated.submat(new Rect(x, y, cropWidth, cropHeight)).clone();
        rotated.release();
        return new ScanImage(cropped);
    }

    /**
     * Size of the largest axis-aligned rectangle inside a {@code w x h} rectangle
     * rotated by {@code angle} radians, from two similar triangles on the angle
     * reduced into its quadrant.
     */
    static double[] largestRotatedRect(int w, int h, double angle) {
        int quadrant = (int) Math.floor(angle / (Math.PI / 2)) & 3;
        double signAlpha = (quadrant & 1) == 0 ? angle : Math.PI - angle;
        double alpha = (signAlpha % Math.PI + Math.PI) % Math.PI;

        double bbW = w * Math.cos(alpha) + h * Math.sin(alpha);
        double bbH = w * Math.sin(alpha) + h * Math.cos(alpha);

        double gamma = Math.atan2(bbW, bbW);
        double delta = Math.PI - alpha - gamma;
        double length = Math.max(w, h);

        double d = length * Math.cos(alpha);
        double a = d * Math.sin(alpha) / Math.sin(delta);
        double y = a * Math.cos(gamma);
        double x = y * Math.tan(gamma);

        return new double[]{bbW - 2 * x, bbH - 2 * y};
    }

    // ==================== Analysis ====================

    /**
     * Finds the needle by normalized cross-correlation; ties go to the first
     * maximum in scan order.
     */
    public TemplateMatch matchTemplate(ScanImage needle) {
        Mat result = new Mat();
        try {
            Imgproc.matchTemplate(data, needle.data, result, Imgproc.TM_CCOEFF_NORMED);
            Core.MinMaxLocResult minMax = Core.minMaxLoc(result);
            double score = Double.isNaN(minMax.maxVal) ? -1.0 : minMax.maxVal;
            return new TemplateMatch((int) minMax.maxLoc.x, (int) minMax.maxLoc.y, score);
        } finally {
            result.release();
        }
    }

    /**
     * Counts external contours after blurring and edge detection.
     *
     * @param kernelSize odd Gaussian kernel size
     */
    public int numberOfShapes(int kernelSize) {
        Mat blurred = new Mat();
        Mat edges = new Mat();
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            Imgproc.GaussianBlur(data, blurred, new Size(kernelSize, kernelSize), 0);
            Imgproc.Canny(blurred, edges, 50, 100, 3, false);
            Imgproc.findContours(edges, contours, hierarchy, Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_NONE);
            return contours.size();
        } finally {
            contours.forEach(Mat::release);
            releaseMat(blurred, edges, hierarchy);
        }
    }

    /**
     * Standard deviation of the pixel values (first channel).
     */
    public double contrast() {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stddev = new MatOfDouble();
        try {
            Core.meanStdDev(data, mean, stddev);
            return stddev.toArray()[0];
        } finally {
            releaseMat(mean, stddev);
        }
    }

    // ==================== Compositing ====================

    /**
     * Paints {@code source} onto {@code dest} at the given offset, skipping the
     * first {@code overlapX} columns of the source. Everything outside the
     * destination is clipped.
     */
    public static void mergeInto(ScanImage dest, ScanImage source, int offsetX, int offsetY, int overlapX) {
        int x1Min = Math.max(0, offsetX + overlapX);
        int x1Max = Math.min(dest.getWidth(), offsetX + source.getWidth());
        int y1Min = Math.max(0, offsetY);
        int y1Max = Math.min(dest.getHeight(), offsetY + source.getHeight());
        if (x1Max <= x1Min || y1Max <= y1Min) {
            return;
        }
        Rect destRect = new Rect(x1Min, y1Min, x1Max - x1Min, y1Max - y1Min);
        Rect sourceRect = new Rect(x1Min - offsetX, y1Min - offsetY, destRect.width, destRect.height);

        Mat target = dest.data.submat(destRect);
        source.data.submat(sourceRect).copyTo(target);
    }

    /**
     * Copy of this image with a full-height vertical line at each x, used to mark seams.
     */
    public ScanImage drawVerticalLines(Scalar color, int thickness, int... xs) {
        Mat copy = data.clone();
        for (int x : xs) {
            Imgproc.line(copy, new Point(x, 0), new Point(x, getHeight() - 1), color, thickness);
        }
        return new ScanImage(copy);
    }

    public void release() {
        data.release();
    }

    static void releaseMat(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null && !mat.empty()) {
                mat.release();
            }
        }
    }

    @Override
    public String toString() {
        return "ScanImage[" + getWidth() + "x" + getHeight() + "x" + getChannels() + "]";
    }
}
