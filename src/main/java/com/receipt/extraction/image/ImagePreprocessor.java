package com.receipt.extraction.image;

import com.receipt.extraction.model.PreprocessedImage;
import com.receipt.extraction.model.PreprocessingOptions;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.RotatedRect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Fixed-order cleanup chain run before OCR:
 *
 *   grayscale → upscale → denoise → deskew → binarize
 *
 * Switching a step off skips it but never reorders the others. Each step is
 * guarded on its own: if OpenCV rejects the input (binarizing a colour image,
 * deskewing a blank page) the image goes on to the next step unchanged.
 */
@Component
@Slf4j
public class ImagePreprocessor {

    static final double UPSCALE_FACTOR = 2.0;
    static final double MIN_SKEW_DEGREES = 0.5;
    static final int MIN_FOREGROUND_PIXELS = 10;

    public ImagePreprocessor() {
        OpenCvSupport.ensureLoaded();
    }

    public PreprocessedImage preprocess(BufferedImage image, PreprocessingOptions options) {
        PreprocessingOptions opts = options == null ? PreprocessingOptions.defaults() : options;
        List<String> applied = new ArrayList<>();
        Mat working = OpenCvSupport.toMat(image);

        try {
            if (opts.isGrayscale()) working = apply("grayscale", working, this::grayscale, applied);
            if (opts.isUpscale())   working = apply("upscale", working, this::upscale, applied);
            if (opts.isDenoise())   working = apply("denoise", working, this::denoise, applied);
            if (opts.isDeskew())    working = apply("deskew", working, this::deskew, applied);
            if (opts.isBinarize())  working = apply("binarize", working, this::binarize, applied);

            double scale = applied.contains("upscale") ? UPSCALE_FACTOR : 1.0;
            log.debug("Preprocessed {}x{} image, steps {}, scale {}", image.getWidth(), image.getHeight(), applied, scale);
            return new PreprocessedImage(OpenCvSupport.toBufferedImage(working), scale, List.copyOf(applied));
        } finally {
            working.release();
        }
    }

    /**
     * Runs one step. When the step produces a new Mat the input is released;
     * a step that passes its input through or fails leaves it alive.
     */
    Mat apply(String step, Mat input, UnaryOperator<Mat> transform, List<String> applied) {
        Mat output;
        try {
            output = transform.apply(input);
        } catch (RuntimeException e) {
            log.warn("Preprocessing step '{}' failed, passing image through: {}", step, e.getMessage());
            return input;
        }

        if (output != input) {
            applied.add(step);
            input.release();
        }
        return output;
    }

    // ─── STEPS ─────────────────────────────────────────────────────────

    private Mat grayscale(Mat src) {
        if (src.channels() != 3) {
            return src;
        }
        Mat dst = new Mat();
        Imgproc.cvtColor(src, dst, Imgproc.COLOR_BGR2GRAY);
        return dst;
    }

    private Mat upscale(Mat src) {
        Mat dst = new Mat();
        Size size = new Size(src.cols() * UPSCALE_FACTOR, src.rows() * UPSCALE_FACTOR);
        Imgproc.resize(src, dst, size, 0, 0, Imgproc.INTER_CUBIC);
        return dst;
    }

    private Mat denoise(Mat src) {
        Mat median = new Mat();
        try {
            Imgproc.medianBlur(src, median, 3);
            Mat dst = new Mat();
            Imgproc.bilateralFilter(median, dst, 9, 75, 75);
            return dst;
        } finally {
            median.release();
        }
    }

    /**
     * Rotates the page so the dark (text) pixels line up with the axes.
     * Returns the input untouched when the estimated skew is within ±0.5°.
     */
    private Mat deskew(Mat src) {
        double angle = estimateSkew(src);
        if (Math.abs(angle) <= MIN_SKEW_DEGREES) {
            return src;
        }

        log.debug("Deskewing by {}°", String.format("%.2f", angle));
        Point center = new Point(src.cols() / 2.0, src.rows() / 2.0);
        Mat rotation = Imgproc.getRotationMatrix2D(center, angle, 1.0);
        try {
            Mat dst = new Mat();
            Imgproc.warpAffine(src, dst, rotation, src.size(), Imgproc.INTER_CUBIC, Core.BORDER_REPLICATE);
            return dst;
        } finally {
            rotation.release();
        }
    }

    double estimateSkew(Mat src) {
        Mat gray = src;
        Mat foreground = new Mat();
        MatOfPoint points = new MatOfPoint();
        MatOfPoint2f points2f = null;

        try {
            if (src.channels() == 3) {
                gray = new Mat();
                Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
            }

            Imgproc.threshold(gray, foreground, 0, 255, Imgproc.THRESH_BINARY_INV | Imgproc.THRESH_OTSU);

            Core.findNonZero(foreground, points);
            if (points.rows() < MIN_FOREGROUND_PIXELS) {
                throw new IllegalStateException("Too few foreground pixels to estimate skew: " + points.rows());
            }

            points2f = new MatOfPoint2f(points.toArray());
            RotatedRect rect = Imgproc.minAreaRect(points2f);
            return normalizeAngle(rect.angle);
        } finally {
            if (gray != src) gray.release();
            foreground.release();
            points.release();
            if (points2f != null) points2f.release();
        }
    }

    private Mat binarize(Mat src) {
        Mat dst = new Mat();
        try {
            Imgproc.adaptiveThreshold(src, dst, 255,
                    Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY, 11, 2);
            return dst;
        } catch (RuntimeException e) {
            dst.release();
            throw e;
        }
    }

    /**
     * Folds a rectangle angle into (-45°, 45°]. minAreaRect reports angles in
     * different ranges across OpenCV versions; a rectangle is the same shape
     * every 90°.
     */
    static double normalizeAngle(double angle) {
        double a = angle;
        while (a > 45.0) a -= 90.0;
        while (a <= -45.0) a += 90.0;
        return a;
    }
}
