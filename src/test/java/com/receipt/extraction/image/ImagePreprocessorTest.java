package com.receipt.extraction.image;

import com.receipt.extraction.model.PreprocessedImage;
import com.receipt.extraction.model.PreprocessingOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;
import org.opencv.core.RotatedRect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ImagePreprocessorTest {

    private final ImagePreprocessor preprocessor = new ImagePreprocessor();

    @Test
    void allStepsOnAnUprightPage() {
        PreprocessedImage result = preprocessor.preprocess(page(200, 120), PreprocessingOptions.defaults());

        assertThat(result.getAppliedSteps()).containsExactly("grayscale", "upscale", "denoise", "binarize");
        assertThat(result.getScaleFactor()).isEqualTo(2.0);
        assertThat(result.getImage().getWidth()).isEqualTo(400);
        assertThat(result.getImage().getHeight()).isEqualTo(240);
    }

    @Test
    void noStepsLeavesSizeAndScaleAlone() {
        PreprocessedImage result = preprocessor.preprocess(page(200, 120), PreprocessingOptions.none());

        assertThat(result.getAppliedSteps()).isEmpty();
        assertThat(result.getScaleFactor()).isEqualTo(1.0);
        assertThat(result.getImage().getWidth()).isEqualTo(200);
        assertThat(result.getImage().getHeight()).isEqualTo(120);
    }

    @Test
    void failingStepPassesTheImageThrough() {
        // adaptive threshold needs a single channel, so binarizing colour fails
        PreprocessingOptions options = PreprocessingOptions.builder()
                .grayscale(false).denoise(false).deskew(false).upscale(false)
                .build();

        PreprocessedImage result = preprocessor.preprocess(page(200, 120), options);

        assertThat(result.getAppliedSteps()).isEmpty();
        assertThat(result.getImage().getWidth()).isEqualTo(200);
    }

    @Test
    void grayscaleInputSkipsConversion() {
        BufferedImage gray = new BufferedImage(60, 40, BufferedImage.TYPE_BYTE_GRAY);
        PreprocessingOptions options = PreprocessingOptions.builder()
                .denoise(false).deskew(false).upscale(false).binarize(false)
                .build();

        PreprocessedImage result = preprocessor.preprocess(gray, options);

        assertThat(result.getAppliedSteps()).isEmpty();
        assertThat(result.getImage().getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
    }

    @Test
    void estimatesSkewOfARotatedBlock() {
        Mat mat = new Mat(400, 400, CvType.CV_8UC1, new Scalar(255));
        Point[] corners = new Point[4];
        new RotatedRect(new Point(200, 200), new Size(300, 60), 10).points(corners);
        Imgproc.fillConvexPoly(mat, new MatOfPoint(corners), new Scalar(0));

        assertThat(Math.abs(preprocessor.estimateSkew(mat))).isCloseTo(10.0, within(1.0));
    }

    @ParameterizedTest
    @ValueSource(doubles = {8.0, -8.0})
    void deskewLeavesThePageLevel(double degrees) {
        PreprocessingOptions options = PreprocessingOptions.builder()
                .denoise(false).upscale(false).binarize(false)
                .build();

        PreprocessedImage result = preprocessor.preprocess(tiltedPage(degrees), options);

        assertThat(result.getAppliedSteps()).containsExactly("grayscale", "deskew");
        Mat deskewed = OpenCvSupport.toMat(result.getImage());
        try {
            assertThat(Math.abs(preprocessor.estimateSkew(deskewed))).isLessThanOrEqualTo(ImagePreprocessor.MIN_SKEW_DEGREES);
        } finally {
            deskewed.release();
        }
    }

    @Test
    void replacedStepInputIsReleased() {
        Mat input = new Mat(10, 10, CvType.CV_8UC1, new Scalar(255));
        List<String> applied = new ArrayList<>();

        Mat output = preprocessor.apply("copy", input, Mat::clone, applied);

        assertThat(input.empty()).isTrue();
        assertThat(output.empty()).isFalse();
        assertThat(applied).containsExactly("copy");
        output.release();
    }

    @Test
    void passedThroughOrFailedStepKeepsItsInput() {
        Mat input = new Mat(10, 10, CvType.CV_8UC1, new Scalar(255));
        List<String> applied = new ArrayList<>();

        Mat same = preprocessor.apply("noop", input, m -> m, applied);
        Mat afterFailure = preprocessor.apply("broken", input, m -> {
            throw new IllegalStateException("no");
        }, applied);

        assertThat(same).isSameAs(input);
        assertThat(afterFailure).isSameAs(input);
        assertThat(input.empty()).isFalse();
        assertThat(applied).isEmpty();
        input.release();
    }

    @Test
    void estimatingSkewLeavesTheCallersImageIntact() {
        Mat gray = new Mat(100, 100, CvType.CV_8UC1, new Scalar(255));
        Imgproc.rectangle(gray, new Point(10, 40), new Point(90, 60), new Scalar(0), -1);

        preprocessor.estimateSkew(gray);

        assertThat(gray.empty()).isFalse();
        assertThat(gray.cols()).isEqualTo(100);
        gray.release();
    }

    @Test
    void tooFewDarkPixelsCannotBeMeasured() {
        Mat mat = new Mat(50, 50, CvType.CV_8UC1, new Scalar(255));
        Imgproc.rectangle(mat, new Point(10, 10), new Point(11, 11), new Scalar(0), -1);

        assertThatThrownBy(() -> preprocessor.estimateSkew(mat)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void foldsAnglesIntoPlusMinus45() {
        assertThat(ImagePreprocessor.normalizeAngle(0)).isEqualTo(0);
        assertThat(ImagePreprocessor.normalizeAngle(90)).isEqualTo(0);
        assertThat(ImagePreprocessor.normalizeAngle(80)).isEqualTo(-10);
        assertThat(ImagePreprocessor.normalizeAngle(-80)).isEqualTo(10);
        assertThat(ImagePreprocessor.normalizeAngle(45)).isEqualTo(45);
        assertThat(ImagePreprocessor.normalizeAngle(-45)).isEqualTo(45);
    }

    private static BufferedImage tiltedPage(double degrees) {
        BufferedImage image = new BufferedImage(400, 400, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 400, 400);
        g.setColor(Color.BLACK);
        g.rotate(Math.toRadians(degrees), 200, 200);
        g.fillRect(50, 170, 300, 60);
        g.dispose();
        return image;
    }

    /** White page with one horizontal dark bar, like a single line of text. */
    private static BufferedImage page(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, width, height);
        g.setColor(Color.BLACK);
        g.fillRect(width / 10, height / 2 - 10, width * 8 / 10, 20);
        g.dispose();
        return image;
    }
}
