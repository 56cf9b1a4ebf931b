package com.receipt.extraction.image;

import lombok.extern.slf4j.Slf4j;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Native loading and BufferedImage/Mat conversion. Only 8-bit gray and
 * 8-bit BGR are produced; every other image type is redrawn as BGR first.
 */
@Slf4j
final class OpenCvSupport {

    private static volatile boolean loaded;

    private OpenCvSupport() {
    }

    static synchronized void ensureLoaded() {
        if (!loaded) {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV {} loaded", org.opencv.core.Core.VERSION);
        }
    }

    static Mat toMat(BufferedImage image) {
        BufferedImage source = image;
        if (image.getType() != BufferedImage.TYPE_BYTE_GRAY && image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            source = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
            Graphics2D g = source.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
        }

        int type = source.getType() == BufferedImage.TYPE_BYTE_GRAY ? CvType.CV_8UC1 : CvType.CV_8UC3;
        byte[] pixels = ((DataBufferByte) source.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(source.getHeight(), source.getWidth(), type);
        mat.put(0, 0, pixels);
        return mat;
    }

    static BufferedImage toBufferedImage(Mat mat) {
        int type = mat.channels() == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR;
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), type);
        byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, pixels);
        return image;
    }
}
